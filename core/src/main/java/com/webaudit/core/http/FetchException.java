package com.webaudit.core.http;

import java.io.IOException;
import java.net.URI;

/** Fetcher 실패 공통 타입 */
public class FetchException extends IOException {
    private final URI uri;

    public FetchException(URI uri, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    public URI getUri() { return uri; }
}
