package com.accessmonitoring.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit sink writing to the transactional outbox table.
 * Runs on the audit executor; persistence failures are logged and never reach the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OutboxAuditSink implements AuditSink {

    static final int MAX_DETAIL_LENGTH = 4000;

    private final OutboxEventRepository outbox;
    private final ObjectMapper objectMapper;

    @Override
    @Async("auditExecutor")
    public void logEvent(AuditEvent event) {
        log.info("AUDIT category={} action={} severity={} resourceType={} resourceId={} principal={}",
                event.getCategory(), event.getAction(), event.getSeverity(),
                event.getResourceType(), event.getResourceId(),
                Encode.forJava(String.valueOf(event.getPrincipalId())));
        try {
            OutboxEvent evt = OutboxEvent.builder()
                    .category(event.getCategory())
                    .action(event.getAction())
                    .severity(event.getSeverity())
                    .resourceType(event.getResourceType())
                    .resourceId(event.getResourceId())
                    .principalId(event.getPrincipalId())
                    .ipAddress(event.getIpAddress())
                    .detail(detail(event))
                    .createdAt(event.getOccurredAt())
                    .processed(false)
                    .build();
            outbox.save(evt);
        } catch (RuntimeException e) {
            log.error("Failed to persist audit event category={} action={}",
                    event.getCategory(), event.getAction(), e);
        }
    }

    private String detail(AuditEvent event) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("description", event.getDescription());
        detail.put("metadata", event.getMetadata());
        try {
            String json = objectMapper.writeValueAsString(detail);
            return json.length() > MAX_DETAIL_LENGTH ? json.substring(0, MAX_DETAIL_LENGTH) : json;
        } catch (JsonProcessingException e) {
            log.warn("Audit metadata not serializable for action={}: {}", event.getAction(), e.getOriginalMessage());
            return String.valueOf(event.getDescription());
        }
    }
}
