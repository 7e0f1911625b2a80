package com.webaudit.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** 포트 → open 여부 (포트 번호 오름차순). 호스트 해석 실패 시 error 만 채워진다. */
public record PortTable(String host, SortedMap<Integer, Boolean> tcp, String error) {

    public PortTable {
        tcp = Collections.unmodifiableSortedMap(new TreeMap<>(tcp == null ? Map.of() : tcp));
    }

    public static PortTable error(String host, String message) {
        return new PortTable(host, new TreeMap<>(), message);
    }

    public boolean isError() { return error != null; }

    /** 열린 포트만 */
    public List<PortFinding> findings() {
        List<PortFinding> out = new ArrayList<>();
        tcp.forEach((port, open) -> {
            if (open) out.add(new PortFinding(host, port, true));
        });
        return out;
    }

    public long openCount() {
        return tcp.values().stream().filter(Boolean::booleanValue).count();
    }
}
