package com.webaudit.core.service;

import com.webaudit.core.model.ScanJob;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryScanJobStore implements ScanJobStore {

    private final ConcurrentMap<String, ScanJob> jobs = new ConcurrentHashMap<>();

    @Override
    public Optional<ScanJob> get(String scanId) {
        if (scanId == null) return Optional.empty();
        return Optional.ofNullable(jobs.get(scanId));
    }

    @Override
    public void put(ScanJob job) {
        Objects.requireNonNull(job, "job");
        jobs.put(job.getId(), job);
    }

    public int size() { return jobs.size(); }
}
