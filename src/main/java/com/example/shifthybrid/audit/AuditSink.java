package com.example.shifthybrid.audit;

public interface AuditSink {

    void accept(AuditEvent event);
}
