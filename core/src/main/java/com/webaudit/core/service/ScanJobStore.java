package com.webaudit.core.service;

import com.webaudit.core.model.ScanJob;

import java.util.Optional;

/** scan_id 기반 잡 저장소 경계(영속화 구현은 외부) */
public interface ScanJobStore {

    Optional<ScanJob> get(String scanId);

    /** 같은 id 면 덮어쓴다 */
    void put(ScanJob job);
}
