package com.webaudit.core.scanner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webaudit.core.model.FetchRequest;
import com.webaudit.core.model.FormSpec;
import com.webaudit.core.util.UrlParamUtil;
import com.webaudit.core.util.UrlUtils;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 값 하나를 바꿔 넣을 수 있는 입력 지점.
 * QUERY: 페이지 URL 의 쿼리 파라미터(GET)
 * FORM : form input (form method, POST 는 urlencoded 또는 JSON 본문)
 */
public record InjectionPoint(URI target, String method, String param, Map<String, String> params,
                             Source source, boolean json) {

    public enum Source { QUERY, FORM }

    private static final ObjectMapper JSON = new ObjectMapper();

    public InjectionPoint {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(param, "param");
        method = (method == null) ? "GET" : method;
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params == null ? Map.of() : params));
    }

    public static InjectionPoint query(URI pageUrl, String param) {
        return new InjectionPoint(pageUrl, "GET", param, UrlParamUtil.parseQuery(pageUrl), Source.QUERY, false);
    }

    public static InjectionPoint form(FormSpec form, String param) {
        return new InjectionPoint(URI.create(form.action()), form.method(), param, form.inputs(), Source.FORM,
                form.isPost() && form.isJson());
    }

    public String originalValue() {
        String v = params.get(param);
        return v == null ? "" : v;
    }

    /** 중복 제거 키: method + 정규화 action + 파라미터명 */
    public String key() {
        return method + " " + UrlUtils.dedupeKey(UrlParamUtil.withoutQuery(target)) + " " + param;
    }

    /** param 만 value 로 바꾸고 나머지는 원래 값 유지 */
    public FetchRequest request(String value) {
        if (source == Source.QUERY) {
            return FetchRequest.get(UrlParamUtil.withParamOverrideFirst(target, param, value));
        }
        Map<String, String> data = new LinkedHashMap<>(params);
        data.put(param, value == null ? "" : value);
        URI action = UrlParamUtil.withoutQuery(target);

        if (!"POST".equals(method)) {
            return FetchRequest.builder(UrlParamUtil.withQuery(action, data)).method(method).build();
        }
        if (json) {
            return FetchRequest.builder(action).method("POST")
                    .header("Content-Type", "application/json")
                    .body(toJson(data))
                    .build();
        }
        return FetchRequest.builder(action).method("POST")
                .header("Content-Type", FormSpec.URLENCODED)
                .body(UrlParamUtil.formEncode(data))
                .build();
    }

    /** 로그/리포트용 위치 */
    public String location() {
        return (source == Source.QUERY ? target : UrlParamUtil.withoutQuery(target)).toString();
    }

    private static String toJson(Map<String, String> data) {
        try {
            return JSON.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("form body serialization failed", e);
        }
    }
}
