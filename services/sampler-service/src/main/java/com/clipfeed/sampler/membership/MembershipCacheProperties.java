package com.clipfeed.sampler.membership;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "membership.cache")
public class MembershipCacheProperties {
    private int capacity = 1000;
    private int batchSize = 5;
    private long checkTimeoutMs = 5000L;

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getCheckTimeoutMs() {
        return checkTimeoutMs;
    }

    public void setCheckTimeoutMs(long checkTimeoutMs) {
        this.checkTimeoutMs = checkTimeoutMs;
    }
}
