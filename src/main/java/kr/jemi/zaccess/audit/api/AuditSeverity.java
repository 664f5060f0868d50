package kr.jemi.zaccess.audit.api;

public enum AuditSeverity {
    INFO,
    WARN,
    ERROR,
    CRITICAL
}
