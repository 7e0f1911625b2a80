package com.webaudit.core.crawler;

import com.webaudit.core.model.FormSpec;

import java.net.URI;
import java.util.List;

/** 이미 받아온 HTML 에서 링크/폼 추출 (네트워크 없음) */
public interface LinkExtractor {

    Extracted extract(URI base, String html);

    /** links 는 문서 등장 순서, http(s)만 */
    record Extracted(List<URI> links, List<FormSpec> forms) {
        public Extracted {
            links = (links == null) ? List.of() : List.copyOf(links);
            forms = (forms == null) ? List.of() : List.copyOf(forms);
        }

        public static Extracted empty() { return new Extracted(List.of(), List.of()); }
    }
}
