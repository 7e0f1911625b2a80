package com.webaudit.core.model;

/** 위험도 등급. 선언 순서가 곧 정렬 순서(INFO가 가장 낮음). */
public enum Severity {
    INFO, LOW, MEDIUM, HIGH, CRITICAL;

    public boolean atLeast(Severity other) {
        return other == null || this.ordinal() >= other.ordinal();
    }
}
