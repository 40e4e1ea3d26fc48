package com.example.shifthybrid.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAuditSink implements AuditSink {

    private static final Logger logger = LoggerFactory.getLogger("com.example.shifthybrid.audit");

    @Override
    public void accept(AuditEvent event) {
        logger.info("[{}] {} {} {} {}", event.runId(), event.snapshotVersion(), event.stage(), event.detail(),
                event.data());
    }
}
