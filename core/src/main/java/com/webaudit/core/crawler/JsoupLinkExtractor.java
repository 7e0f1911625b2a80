package com.webaudit.core.crawler;

import com.webaudit.core.model.FormSpec;
import com.webaudit.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** JSoup 기반 추출기: a[href] → abs:href, form → FormSpec */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public Extracted extract(URI base, String html) {
        if (base == null || html == null || html.isBlank()) return Extracted.empty();

        Document doc = Jsoup.parse(html, base.toString());

        Set<URI> links = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            URI u = toHttpUri(a.attr("abs:href"));
            if (u != null) links.add(u);
        }

        List<FormSpec> forms = new ArrayList<>();
        for (Element f : doc.select("form")) {
            FormSpec form = toForm(base, f);
            if (form != null) forms.add(form);
        }
        return new Extracted(new ArrayList<>(links), forms);
    }

    /** action 이 없으면 현재 페이지. method 기본 GET. */
    private static FormSpec toForm(URI base, Element form) {
        String action = form.hasAttr("action") ? form.attr("abs:action") : "";
        URI actionUri = action.isBlank() ? base : toHttpUri(action);
        if (actionUri == null) return null; // javascript: 등

        Map<String, String> inputs = new LinkedHashMap<>();
        for (Element in : form.select("input[name], textarea[name], select[name]")) {
            String name = in.attr("name").trim();
            if (name.isEmpty() || inputs.containsKey(name)) continue;
            String type = in.attr("type").toLowerCase(java.util.Locale.ROOT);
            if (type.equals("submit") || type.equals("button") || type.equals("image") || type.equals("file")) continue;
            inputs.put(name, defaultValue(in));
        }
        return new FormSpec(actionUri.toString(), form.attr("method"), form.attr("enctype"), inputs);
    }

    private static String defaultValue(Element in) {
        switch (in.normalName()) {
            case "textarea":
                return in.text();
            case "select": {
                Element selected = in.selectFirst("option[selected]");
                if (selected == null) selected = in.selectFirst("option");
                if (selected == null) return "";
                return selected.hasAttr("value") ? selected.attr("value") : selected.text();
            }
            default:
                return in.attr("value");
        }
    }

    private static URI toHttpUri(String abs) {
        if (abs == null || abs.isBlank()) return null;
        try {
            URI u = URI.create(abs.trim());
            return UrlUtils.isHttp(u) ? u : null;
        } catch (IllegalArgumentException ignore) {
            return null; // 잘못된 URL은 건너뜀
        }
    }
}
