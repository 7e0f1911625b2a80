package com.webaudit.core.scanner;

import com.webaudit.core.model.FormSpec;
import com.webaudit.core.model.PageRecord;
import com.webaudit.core.util.UrlParamUtil;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** PageRecord 목록 → 중복 제거된 InjectionPoint 목록(발견 순서 유지) */
public final class InjectionPoints {
    private InjectionPoints() {}

    public static List<InjectionPoint> collect(List<PageRecord> pages) {
        Map<String, InjectionPoint> byKey = new LinkedHashMap<>();
        if (pages == null) return List.of();
        for (PageRecord page : pages) {
            URI url;
            try {
                url = page.uri();
            } catch (IllegalArgumentException e) {
                continue;
            }
            for (String name : UrlParamUtil.parseQuery(url).keySet()) {
                add(byKey, InjectionPoint.query(url, name));
            }
            for (FormSpec form : page.forms()) {
                for (String name : form.inputs().keySet()) {
                    try {
                        add(byKey, InjectionPoint.form(form, name));
                    } catch (IllegalArgumentException e) {
                        // action URL 이 깨진 form 은 건너뜀
                        break;
                    }
                }
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private static void add(Map<String, InjectionPoint> byKey, InjectionPoint p) {
        byKey.putIfAbsent(p.key(), p);
    }
}
