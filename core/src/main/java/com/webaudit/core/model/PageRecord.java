package com.webaudit.core.model;

import com.webaudit.core.util.UrlUtils;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/** 크롤러가 실제로 방문한 페이지 + 추출된 form 목록 (생성 후 불변) */
public record PageRecord(String url, int status, List<FormSpec> forms) {

    public PageRecord {
        Objects.requireNonNull(url, "url");
        forms = (forms == null) ? List.of() : List.copyOf(forms);
    }

    public URI uri() { return URI.create(url); }

    /** scheme+host+path+정렬된 쿼리 키. 동등 페이지 중복 테스트 방지용. */
    public String dedupeKey() { return UrlUtils.dedupeKey(uri()); }
}
