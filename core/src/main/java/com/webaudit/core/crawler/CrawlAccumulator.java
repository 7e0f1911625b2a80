package com.webaudit.core.crawler;

import com.webaudit.core.model.CrawlResult;
import com.webaudit.core.model.PageRecord;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** 크롤 중간 결과. 크롤 스레드가 쓰고, 오케스트레이터가 언제든 스냅샷을 뜬다. */
public final class CrawlAccumulator {
    private final Set<String> discovered = new LinkedHashSet<>();
    private final Map<String, PageRecord> pages = new LinkedHashMap<>();   // dedupeKey → page
    private final Map<String, String> errors = new LinkedHashMap<>();

    public synchronized void discovered(URI u) {
        if (u != null) discovered.add(u.toString());
    }

    public synchronized void page(PageRecord p) {
        pages.putIfAbsent(p.dedupeKey(), p);
    }

    public synchronized void error(URI u, String message) {
        errors.put(String.valueOf(u), message);
    }

    public synchronized int pageCount() { return pages.size(); }

    public synchronized CrawlResult snapshot() {
        return new CrawlResult(new ArrayList<>(discovered), new ArrayList<>(pages.values()), errors);
    }
}
