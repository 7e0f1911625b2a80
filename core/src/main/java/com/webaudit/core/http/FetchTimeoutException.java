package com.webaudit.core.http;

import java.net.URI;
import java.time.Duration;

/** 요청 타임아웃. 재시도하지 않는다. */
public class FetchTimeoutException extends FetchException {
    public FetchTimeoutException(URI uri, Duration timeout, Throwable cause) {
        super(uri, "timed out after " + timeout.toMillis() + "ms", cause);
    }
}
