package com.webaudit.core.api;

/** 같은 scan_id 로 sqlmap 실행이 이미 진행 중 */
public class ScanBusyException extends IllegalStateException {
    public ScanBusyException(String message) { super(message); }
}
