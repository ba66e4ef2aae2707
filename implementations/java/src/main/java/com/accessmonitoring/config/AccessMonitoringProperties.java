package com.accessmonitoring.config;

import com.accessmonitoring.domain.access.Permission;
import com.accessmonitoring.domain.access.UserAccess;
import com.accessmonitoring.domain.activity.BusinessHours;
import com.accessmonitoring.domain.consent.ConsentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tunable thresholds and cadences for access control and monitoring.
 *
 * <p>Defaults match the values the service has always shipped with; none of them
 * should be changed without a documented reason.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "access-monitoring")
public class AccessMonitoringProperties {

    /** Consecutive failed logins that lock an account. */
    @Min(1)
    private int lockoutThreshold = 5;

    /** Session timeout given to newly created access records. */
    @NotNull
    private Duration sessionTimeout = UserAccess.DEFAULT_SESSION_TIMEOUT;

    /** Users provisioned with the ADMIN role at start-up if they have no access record. */
    @NotNull
    private List<String> bootstrapAdmins = new ArrayList<>();

    @Valid
    private BusinessHoursProperties businessHours = new BusinessHoursProperties();
    @Valid
    private QueueProperties queue = new QueueProperties();
    @Valid
    private ActivityLogProperties activityLog = new ActivityLogProperties();
    @Valid
    private MonitorProperties monitor = new MonitorProperties();
    @Valid
    private DetectorProperties detector = new DetectorProperties();
    @Valid
    private BreachProperties breach = new BreachProperties();
    @Valid
    private WorkerProperties workers = new WorkerProperties();
    @Valid
    private ConsentProperties consent = new ConsentProperties();
    @Valid
    private PersistenceProperties persistence = new PersistenceProperties();

    public BusinessHours toBusinessHours() {
        return new BusinessHours(
            businessHours.getStartHour(),
            businessHours.getEndHour(),
            ZoneId.of(businessHours.getZone()));
    }

    @Data
    public static class BusinessHoursProperties {
        @Min(0) @Max(23)
        private int startHour = 6;
        @Min(0) @Max(23)
        private int endHour = 22;
        @NotNull
        private String zone = "UTC";
    }

    @Data
    public static class QueueProperties {
        @Min(1)
        private int capacity = 1000;
    }

    @Data
    public static class ActivityLogProperties {
        @NotNull
        private Duration retention = Duration.ofDays(7);
    }

    @Data
    public static class MonitorProperties {
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(1);
        private double unusualRiskThreshold = 8.0;
        @NotNull
        private Duration rapidWindow = Duration.ofSeconds(60);
        @Min(1)
        private int rapidThreshold = 10;
    }

    @Data
    public static class DetectorProperties {
        @NotNull
        private Duration scanInterval = Duration.ofSeconds(30);
        @NotNull
        private Duration window = Duration.ofHours(1);
        @Min(0)
        private int roleChangeThreshold = 1;
        @Min(0)
        private int failedLoginThreshold = 3;
        @Min(0)
        private int dataAccessThreshold = 20;
    }

    @Data
    public static class BreachProperties {
        @NotNull
        private Duration scanInterval = Duration.ofSeconds(60);
        @NotNull
        private Duration window = Duration.ofMinutes(5);
        @Min(0)
        private int exportThreshold = 5;
    }

    @Data
    public static class WorkerProperties {
        /** Start the background workers with the application context. */
        private boolean enabled = true;
        @Min(1)
        private int degradedAfterFailures = 3;
    }

    @Data
    public static class ConsentProperties {
        /** Permissions whose use requires the data subject's consent of the given type. */
        @NotNull
        private Map<Permission, ConsentType> gatedPermissions = defaultGatedPermissions();

        private static Map<Permission, ConsentType> defaultGatedPermissions() {
            Map<Permission, ConsentType> gated = new EnumMap<>(Permission.class);
            gated.put(Permission.VIEW_ANALYTICS, ConsentType.DATA_PROCESSING);
            return gated;
        }
    }

    @Data
    public static class PersistenceProperties {
        /** JSON snapshot location; unset keeps state in memory only. */
        private String snapshotFile;
    }
}
