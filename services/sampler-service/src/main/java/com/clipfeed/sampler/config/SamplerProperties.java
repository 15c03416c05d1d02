package com.clipfeed.sampler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sampler")
public class SamplerProperties {
    private int poolSize = 4;
    private final ShortForm shortForm = new ShortForm();
    private final FanOut fanOut = new FanOut();

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public ShortForm getShortForm() {
        return shortForm;
    }

    public FanOut getFanOut() {
        return fanOut;
    }

    public enum ShortFormMode {
        NATIVE,
        WINDOW,
        FAN_OUT
    }

    public static class ShortForm {
        private ShortFormMode mode = ShortFormMode.WINDOW;
        private int window = 24;

        public ShortFormMode getMode() {
            return mode;
        }

        public void setMode(ShortFormMode mode) {
            this.mode = mode;
        }

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }
    }

    public static class FanOut {
        private int pageCount = 3;
        private long pageTimeoutMs = 5000L;

        public int getPageCount() {
            return pageCount;
        }

        public void setPageCount(int pageCount) {
            this.pageCount = pageCount;
        }

        public long getPageTimeoutMs() {
            return pageTimeoutMs;
        }

        public void setPageTimeoutMs(long pageTimeoutMs) {
            this.pageTimeoutMs = pageTimeoutMs;
        }
    }
}
