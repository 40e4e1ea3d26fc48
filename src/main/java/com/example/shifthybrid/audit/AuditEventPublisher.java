package com.example.shifthybrid.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Hands events to every {@link AuditSink} on the audit executor. A failing sink is
 * logged and never reaches the generation run.
 */
@Component
public class AuditEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(AuditEventPublisher.class);

    private final List<AuditSink> sinks;
    private final Executor auditExecutor;

    public AuditEventPublisher(List<AuditSink> sinks, @Qualifier("auditExecutor") Executor auditExecutor) {
        this.sinks = List.copyOf(sinks);
        this.auditExecutor = auditExecutor;
    }

    public void publish(AuditEvent event) {
        for (AuditSink sink : sinks) {
            try {
                auditExecutor.execute(() -> deliver(sink, event));
            } catch (RuntimeException e) {
                logger.warn("Audit event {} for run {} dropped: {}", event.stage(), event.runId(), e.getMessage());
            }
        }
    }

    private void deliver(AuditSink sink, AuditEvent event) {
        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            logger.warn("Audit sink {} failed on {} for run {}", sink.getClass().getSimpleName(), event.stage(),
                    event.runId(), e);
        }
    }
}
