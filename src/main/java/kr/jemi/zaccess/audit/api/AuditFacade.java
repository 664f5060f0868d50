package kr.jemi.zaccess.audit.api;

public interface AuditFacade {

    void record(AuditRecord record);

    /**
     * 보존 기간이 지난 감사 로그에 archived 표시를 한다. 삭제하지 않는다.
     * @return 이번에 표시된 건수
     */
    int archiveExpired();
}
