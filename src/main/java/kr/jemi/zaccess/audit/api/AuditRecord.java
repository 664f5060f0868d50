package kr.jemi.zaccess.audit.api;

import java.util.Map;

public record AuditRecord(String eventType, String category, AuditSeverity severity,
                          String description, Map<String, Object> metadata) {

    public AuditRecord {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
