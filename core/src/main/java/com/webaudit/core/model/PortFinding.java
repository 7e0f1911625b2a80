package com.webaudit.core.model;

public record PortFinding(String host, int port, boolean open) implements Finding {

    @Override public FindingKind kind() { return FindingKind.PORT; }

    @Override public String location() { return host + ":" + port; }

    @Override public Severity severity() {
        if (!open) return Severity.INFO;
        return switch (port) {
            case 21, 23, 1433, 1521, 3306, 5432, 6379, 9200 -> Severity.HIGH;
            case 22 -> Severity.MEDIUM;
            case 443, 8443 -> Severity.INFO;
            default -> Severity.LOW;
        };
    }

    @Override public String evidence() { return open ? "tcp connect ok" : "closed"; }

    @Override public boolean actionable() { return open; }
}
