package com.accessmonitoring.config;

import com.accessmonitoring.application.RiskScorer;
import com.accessmonitoring.infrastructure.compliance.ComplianceCollaborator;
import com.accessmonitoring.infrastructure.compliance.DenyingComplianceCollaborator;
import com.accessmonitoring.infrastructure.persistence.InMemorySecurityStateRepository;
import com.accessmonitoring.infrastructure.persistence.JsonFileSecurityStateRepository;
import com.accessmonitoring.infrastructure.persistence.SecurityStateRepository;
import com.accessmonitoring.infrastructure.security.IpReputationService;
import com.accessmonitoring.infrastructure.security.ReservedRangeIpReputationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Collaborators outside the access-control core. Each default can be replaced by
 * declaring a bean of the same type.
 */
@Configuration
@Slf4j
public class IntegrationConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public IpReputationService ipReputationService() {
        return new ReservedRangeIpReputationService();
    }

    @Bean
    public RiskScorer riskScorer(IpReputationService ipReputationService, AccessMonitoringProperties properties) {
        return new RiskScorer(ipReputationService, properties.toBusinessHours());
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplianceCollaborator complianceCollaborator() {
        log.warn("No compliance service configured; bank-account scoped access will be denied");
        return new DenyingComplianceCollaborator();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityStateRepository securityStateRepository(
            AccessMonitoringProperties properties, ObjectMapper objectMapper) {
        String snapshotFile = properties.getPersistence().getSnapshotFile();
        if (snapshotFile == null || snapshotFile.isBlank()) {
            return new InMemorySecurityStateRepository();
        }
        log.info("Security state snapshots stored in {}", snapshotFile);
        return new JsonFileSecurityStateRepository(Path.of(snapshotFile), objectMapper);
    }
}
