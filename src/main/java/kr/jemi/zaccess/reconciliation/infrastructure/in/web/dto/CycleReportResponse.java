package kr.jemi.zaccess.reconciliation.infrastructure.in.web.dto;

import kr.jemi.zaccess.reconciliation.domain.CycleReport;

import java.time.LocalDateTime;
import java.util.List;

public record CycleReportResponse(LocalDateTime startedAt, long durationMillis, List<TaskResult> tasks) {

    public record TaskResult(String task, String status, int processed, int found, String error) {
    }

    public static CycleReportResponse from(CycleReport report) {
        List<TaskResult> tasks = report.outcomes().stream()
                .map(o -> new TaskResult(o.task().name(), o.status().name(), o.processed(), o.found(), o.error()))
                .toList();
        return new CycleReportResponse(report.startedAt(), report.duration().toMillis(), tasks);
    }
}
