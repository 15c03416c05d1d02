package com.clipfeed.sampler.common;

public enum ReadStatus {
    OK,
    ABORTED,
    FAILED
}
