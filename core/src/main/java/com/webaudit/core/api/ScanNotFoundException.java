package com.webaudit.core.api;

/** 알 수 없는 scan_id 이거나 Phase 1 이 끝나지 않은 잡 */
public class ScanNotFoundException extends ScanArgumentException {
    private final String scanId;

    public ScanNotFoundException(String scanId, String message) {
        super(message);
        this.scanId = scanId;
    }

    public String getScanId() { return scanId; }
}
