package com.clipfeed.sampler.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import org.springframework.http.HttpHeaders;

public final class RequestIds {
    public static final String TRACE_HEADER = "x-trace-id";
    public static final String REQUEST_HEADER = "x-request-id";

    private final String traceId;
    private final String requestId;

    private RequestIds(String traceId, String requestId) {
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public static RequestIds of(String traceHeader, String requestHeader) {
        return new RequestIds(orGenerate(traceHeader), orGenerate(requestHeader));
    }

    public static RequestIds from(HttpServletRequest request) {
        if (request == null) {
            return of(null, null);
        }
        return of(request.getHeader(TRACE_HEADER), request.getHeader(REQUEST_HEADER));
    }

    private static String orGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value.trim();
        }
        return UUID.randomUUID().toString();
    }

    public HttpHeaders toHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(TRACE_HEADER, traceId);
        headers.set(REQUEST_HEADER, requestId);
        return headers;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRequestId() {
        return requestId;
    }
}
