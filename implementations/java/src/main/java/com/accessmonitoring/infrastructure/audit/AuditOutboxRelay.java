package com.accessmonitoring.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Relays outbox rows downstream. The downstream is currently the application log;
 * rows are marked processed once relayed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditOutboxRelay {
    private final OutboxEventRepository repository;

    @Scheduled(fixedDelayString = "${access-monitoring.audit.relay-interval:10000}")
    @Transactional
    public int publish() {
        List<OutboxEvent> pending = repository.findTop500ByProcessedFalseOrderByIdAsc();
        for (OutboxEvent e : pending) {
            if (log.isInfoEnabled()) {
                log.info("OUTBOX publish id={} category={} action={} severity={} resourceId={} createdAt={}",
                        e.getId(), e.getCategory(), e.getAction(), e.getSeverity(),
                        e.getResourceId(), e.getCreatedAt());
            }
            e.setProcessed(true);
        }
        repository.saveAll(pending);
        return pending.size();
    }
}
