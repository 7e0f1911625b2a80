package com.webaudit.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * HTML form 추출 결과.
 * inputs 는 선언 순서를 유지한다(name → 기본값).
 */
public record FormSpec(String action, String method, String enctype, Map<String, String> inputs) {

    public static final String URLENCODED = "application/x-www-form-urlencoded";

    public FormSpec {
        Objects.requireNonNull(action, "action");
        method = (method == null || method.isBlank()) ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        enctype = (enctype == null || enctype.isBlank()) ? URLENCODED : enctype.trim().toLowerCase(Locale.ROOT);
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs == null ? Map.of() : inputs));
    }

    public boolean isPost() { return "POST".equals(method); }

    public boolean isJson() { return enctype.contains("json"); }
}
