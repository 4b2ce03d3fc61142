package com.powerscheduler.core.msg;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.powerscheduler.core.model.LabelSelector;
import com.powerscheduler.core.model.ScaleRequest;
import com.powerscheduler.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Turns an inbound payload into a {@link ScaleRequest}.
 * <p>
 * Accepts either the request JSON itself or a Pub/Sub push envelope
 * ({@code {"message": {"data": "<base64 request JSON>"}}}).
 * </p>
 * <p>
 * A payload that cannot be decoded at all (bad JSON, trailing tokens, bad base64,
 * not an object) is logged and replaced by {@link ScaleRequest#empty()}, i.e. a
 * {@code scale_down} with all defaults.
 * </p>
 * <p>
 * A well-formed object whose fields are wrong (mistyped field, blank label key,
 * label without value) keeps its {@code action} and is marked invalid via
 * {@link ScaleRequest#getInvalidReason()}; it never turns into another intent.
 * Empty {@code vm_labels} or {@code zones} lists count as absent.
 * </p>
 */
public final class ScaleRequestDecoder {
    private static final Logger log = LoggerFactory.getLogger(ScaleRequestDecoder.class);

    private static final ObjectReader READER = JsonUtils.mapper().reader()
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private ScaleRequestDecoder() {
    }

    public static ScaleRequest decode(String payload) {
        JsonNode root;
        try {
            root = readObject(payload == null ? "" : payload);

            JsonNode data = root.path("message").path("data");
            if (data.isTextual()) {
                byte[] decoded = Base64.getDecoder().decode(data.asText());
                root = readObject(new String(decoded, StandardCharsets.UTF_8));
            }
        } catch (Exception e) {
            log.error("Error decoding message: {}", e.getMessage());
            return ScaleRequest.empty();
        }

        try {
            ScaleRequestMessage message = READER.treeToValue(root, ScaleRequestMessage.class);
            return toRequest(message);
        } catch (Exception e) {
            String action = actionOf(root);
            log.error("Invalid {} request: {}", action, e.getMessage());
            return ScaleRequest.builder()
                .action(action)
                .invalidReason("Invalid request: " + e.getMessage())
                .build();
        }
    }

    private static JsonNode readObject(String json) throws Exception {
        JsonNode node = READER.readTree(json);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("payload is not a JSON object");
        }
        return node;
    }

    private static String actionOf(JsonNode root) {
        JsonNode action = root.path("action");
        if (action.isMissingNode() || action.isNull()) {
            return ScaleRequest.DEFAULT_ACTION;
        }
        return action.isTextual() ? action.asText() : action.toString();
    }

    static ScaleRequest toRequest(ScaleRequestMessage message) {
        ScaleRequest.ScaleRequestBuilder builder = ScaleRequest.builder()
            .projectId(blankToNull(message.getProjectId()))
            .selector(toSelector(message.getVmLabels()))
            .zones(toZones(message.getZones()));
        if (message.getAction() != null) {
            builder.action(message.getAction());
        }
        return builder.build();
    }

    private static LabelSelector toSelector(List<ScaleRequestMessage.LabelEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return null;
        }
        List<LabelSelector.Label> labels = new ArrayList<>(entries.size());
        for (ScaleRequestMessage.LabelEntry entry : entries) {
            if (entry == null) {
                throw new IllegalArgumentException("vm_labels contains a null entry");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("vm_labels entry '" + entry.getKey() + "' has no value");
            }
            labels.add(new LabelSelector.Label(entry.getKey(), entry.getValue()));
        }
        return LabelSelector.of(labels);
    }

    private static List<String> toZones(List<String> zones) {
        if (zones == null) {
            return null;
        }
        List<String> result = new ArrayList<>(zones.size());
        for (String zone : zones) {
            if (zone != null && !zone.isBlank()) {
                result.add(zone.trim());
            }
        }
        return result.isEmpty() ? null : List.copyOf(result);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
