package com.powerscheduler.scheduler.config;

import com.google.common.base.Splitter;
import com.powerscheduler.core.label.LabelSelectorParser;
import com.powerscheduler.core.model.LabelSelector;
import com.powerscheduler.core.model.ScaleConfig;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Configuration for the scheduler service, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SchedulerConfig {
    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    public static final String DEFAULT_LABELS = "auto-schedule:true";
    public static final String DEFAULT_ZONES = "us-central1-a,us-central1-b";

    String nodeId;
    int httpPort;

    // Kafka transport
    boolean kafkaEnabled;
    String kafkaBootstrap;
    String kafkaGroupId;

    // Request defaults
    String defaultProjectId;      // null when GCP_PROJECT is unset
    LabelSelector defaultSelector;
    List<String> defaultZones;

    ScaleConfig scaleConfig;

    public static SchedulerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static SchedulerConfig fromEnv(Map<String, String> env) {
        String project = getEnv(env, "GCP_PROJECT", null);
        return SchedulerConfig.builder()
            .nodeId(getEnv(env, "NODE_ID", "vm-scheduler-1"))
            .httpPort(Integer.parseInt(getEnv(env, "HTTP_PORT", "8080")))
            .kafkaEnabled(Boolean.parseBoolean(getEnv(env, "KAFKA_ENABLED", "true")))
            .kafkaBootstrap(getEnv(env, "KAFKA_BOOTSTRAP", "localhost:9092"))
            .kafkaGroupId(getEnv(env, "KAFKA_GROUP_ID", "vm-scheduler"))
            .defaultProjectId(project == null || project.isBlank() ? null : project.trim())
            .defaultSelector(LabelSelectorParser.parse(getEnv(env, "VM_LABELS", DEFAULT_LABELS)))
            .defaultZones(parseZones(getEnv(env, "VM_ZONES", DEFAULT_ZONES)))
            .scaleConfig(ScaleConfig.builder()
                .scaleDownOperation(parseScaleDown(getEnv(env, "SCALE_DOWN_ACTION", "STOP")))
                .scaleUpOperation(parseScaleUp(getEnv(env, "SCALE_UP_ACTION", "START")))
                .build())
            .build();
    }

    static List<String> parseZones(String zones) {
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(zones);
    }

    static ScaleConfig.ScaleDownOperation parseScaleDown(String value) {
        if ("SUSPEND".equals(value)) {
            return ScaleConfig.ScaleDownOperation.SUSPEND;
        }
        if (!"STOP".equals(value)) {
            log.warn("Unrecognized SCALE_DOWN_ACTION '{}', using STOP", value);
        }
        return ScaleConfig.ScaleDownOperation.STOP;
    }

    static ScaleConfig.ScaleUpOperation parseScaleUp(String value) {
        if ("RESUME".equals(value)) {
            return ScaleConfig.ScaleUpOperation.RESUME;
        }
        if (!"START".equals(value)) {
            log.warn("Unrecognized SCALE_UP_ACTION '{}', using START", value);
        }
        return ScaleConfig.ScaleUpOperation.START;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }
}
