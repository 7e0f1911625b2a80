package com.webaudit.core.api;

/** 잘못된 스캔 입력(Phase 1/2 요청값, sqlmap 인자 등). 작업 시작 전에 즉시 거부된다. */
public class ScanArgumentException extends IllegalArgumentException {
    public ScanArgumentException(String message) { super(message); }
    public ScanArgumentException(String message, Throwable cause) { super(message, cause); }
}
