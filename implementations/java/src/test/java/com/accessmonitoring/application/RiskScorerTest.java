package com.accessmonitoring.application;

import com.accessmonitoring.domain.activity.ActivityMetadata;
import com.accessmonitoring.domain.activity.ActivityType;
import com.accessmonitoring.domain.activity.BusinessHours;
import com.accessmonitoring.infrastructure.security.ReservedRangeIpReputationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigInteger;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Risk scoring")
class RiskScorerTest {

    private static final Instant MIDDAY = Instant.parse("2024-03-05T12:00:00Z");
    private static final Instant NIGHT = Instant.parse("2024-03-05T03:00:00Z");

    private final RiskScorer scorer = new RiskScorer(
        new ReservedRangeIpReputationService(), new BusinessHours(6, 22, ZoneOffset.UTC));

    @ParameterizedTest(name = "{0} scores {1}")
    @CsvSource({
        "LOGIN, 1", "LOGOUT, 1", "DATA_ACCESS, 2", "DATA_MODIFICATION, 5", "ACCOUNT_CREATION, 3",
        "ACCOUNT_DELETION, 8", "PERMISSION_CHANGE, 7", "ROLE_CHANGE, 8",
        "SUSPICIOUS_ACTIVITY, 10", "SECURITY_VIOLATION, 10"
    })
    @DisplayName("Base score per activity type")
    void baseScores(ActivityType type, double expected) {
        assertThat(scorer.score(type, Map.of(), "203.0.113.7", MIDDAY)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Failures, private addresses and off-hours add up")
    void additiveFactors() {
        Map<String, Object> failures = Map.of(ActivityMetadata.FAILED_ATTEMPTS, 2);

        assertThat(scorer.score(ActivityType.LOGIN, failures, "203.0.113.7", MIDDAY)).isEqualTo(5.0);
        assertThat(scorer.score(ActivityType.LOGIN, Map.of(), "192.168.1.20", MIDDAY)).isEqualTo(6.0);
        assertThat(scorer.score(ActivityType.LOGIN, Map.of(), "203.0.113.7", NIGHT)).isEqualTo(4.0);
        assertThat(scorer.score(ActivityType.DATA_ACCESS, failures, "10.1.2.3", NIGHT)).isEqualTo(10.0);
    }

    @ParameterizedTest(name = "failed_attempts {0}")
    @MethodSource("outOfRangeFailureCounts")
    @DisplayName("Failure counts beyond the int range still max out the score")
    void hugeFailureCounts(Object failedAttempts) {
        Map<String, Object> metadata = Map.of(ActivityMetadata.FAILED_ATTEMPTS, failedAttempts);

        assertThat(scorer.score(ActivityType.LOGIN, metadata, "203.0.113.7", MIDDAY)).isEqualTo(10.0);
    }

    static List<Object> outOfRangeFailureCounts() {
        return List.of(4_294_967_297L, Long.MAX_VALUE, 1e12, new BigInteger("99999999999999999999"),
            "4294967297");
    }

    @Test
    @DisplayName("An unknown address is not suspicious")
    void unknownAddress() {
        assertThat(scorer.isSuspiciousIp(ActivityMetadata.UNKNOWN)).isFalse();
        assertThat(scorer.isSuspiciousIp(null)).isFalse();
        assertThat(scorer.isSuspiciousIp("172.20.0.1")).isTrue();
        assertThat(scorer.isSuspiciousIp("172.32.0.1")).isFalse();
    }

    @Test
    @DisplayName("Score stays within [0, 10] for every input combination")
    void boundedOverInputSpace() {
        List<Object> failedAttemptValues = Arrays.asList(
            null, 0, 1, 3, 5, 100, -1, -1000, Integer.MAX_VALUE, Integer.MIN_VALUE,
            Long.MAX_VALUE, 2.5, Double.NaN, Double.POSITIVE_INFINITY, "7", "-4", "junk", "", true);
        List<String> addresses = Arrays.asList(
            null, "unknown", "", "203.0.113.7", "127.0.0.1", "0.0.0.9", "10.0.0.1", "192.168.0.1", "::1");

        int checked = 0;
        for (ActivityType type : ActivityType.values()) {
            for (Object failed : failedAttemptValues) {
                Map<String, Object> metadata = new HashMap<>();
                metadata.put(ActivityMetadata.FAILED_ATTEMPTS, failed);
                for (String address : addresses) {
                    for (int hour = 0; hour < 24; hour++) {
                        Instant at = MIDDAY.truncatedTo(ChronoUnit.DAYS).plusSeconds(hour * 3600L);
                        double score = scorer.score(type, metadata, address, at);
                        assertThat(score).as("%s %s %s %d", type, failed, address, hour).isBetween(0.0, 10.0);
                        checked++;
                    }
                }
            }
            assertThat(scorer.score(type, null, null, MIDDAY)).isBetween(0.0, 10.0);
        }
        assertThat(checked).isGreaterThan(4000);
    }

    @Test
    void clampHandlesNaN() {
        assertThat(RiskScorer.clamp(Double.NaN)).isEqualTo(RiskScorer.MAX_SCORE);
        assertThat(RiskScorer.clamp(-3)).isEqualTo(RiskScorer.MIN_SCORE);
    }
}
