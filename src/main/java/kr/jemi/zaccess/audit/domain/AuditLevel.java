package kr.jemi.zaccess.audit.domain;

public enum AuditLevel {
    INFO,
    WARN,
    ERROR,
    CRITICAL
}
