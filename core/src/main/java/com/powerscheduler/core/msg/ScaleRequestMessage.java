package com.powerscheduler.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Wire form of a scale request.
 * <pre>
 * {
 *   "action": "scale_up" | "scale_down",
 *   "project_id": "my-project",
 *   "vm_labels": [{"key": "auto-schedule", "value": "true"}],
 *   "zones": ["us-central1-a"]
 * }
 * </pre>
 * Every field is optional.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScaleRequestMessage {

    @JsonProperty("action")
    String action;

    @JsonProperty("project_id")
    String projectId;

    @JsonProperty("vm_labels")
    List<LabelEntry> vmLabels;

    @JsonProperty("zones")
    List<String> zones;

    @JsonCreator
    public ScaleRequestMessage(
        @JsonProperty("action") String action,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("vm_labels") List<LabelEntry> vmLabels,
        @JsonProperty("zones") List<String> zones
    ) {
        this.action = action;
        this.projectId = projectId;
        this.vmLabels = vmLabels;
        this.zones = zones;
    }

    @Value
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LabelEntry {
        @JsonProperty("key")
        String key;

        @JsonProperty("value")
        String value;

        @JsonCreator
        public LabelEntry(
            @JsonProperty("key") String key,
            @JsonProperty("value") String value
        ) {
            this.key = key;
            this.value = value;
        }
    }
}
