package com.webaudit.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 크롤 결과.
 * urls   : 발견 순서대로의 URL(미방문/타 도메인 포함)
 * pages  : 방문 성공 페이지
 * errors : 방문 실패 URL → 사유
 */
public record CrawlResult(List<String> urls, List<PageRecord> pages, Map<String, String> errors) {

    public CrawlResult {
        urls = (urls == null) ? List.of() : List.copyOf(urls);
        pages = (pages == null) ? List.of() : List.copyOf(pages);
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors == null ? Map.of() : errors));
    }

    public static CrawlResult empty() { return new CrawlResult(List.of(), List.of(), Map.of()); }
}
