package com.webaudit.core.model;

/** Finding 태그. 리포트 그룹 키와 1:1 대응. */
public enum FindingKind {
    PORT, HEADER, XSS, SQLI, SQLMAP
}
