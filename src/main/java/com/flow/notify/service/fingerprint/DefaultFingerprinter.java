package com.flow.notify.service.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.model.NotificationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SHA-256 based fingerprinter.
 *
 * Each component is length-prefixed before hashing, so no choice of separator
 * inside a value can make two component lists encode alike. Custom templates
 * that fail to evaluate fall back to the basic fingerprint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultFingerprinter implements Fingerprinter {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");
    private static final String PAYLOAD_PREFIX = "payload.";

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .build();

    private final MetricsConfig metricsConfig;

    @Override
    public String fingerprint(NotificationEvent event, FingerprintPolicy policy) {
        if (policy == null || policy instanceof FingerprintPolicy.Basic) {
            return basic(event);
        }
        if (policy instanceof FingerprintPolicy.None) {
            return "none:" + UUID.randomUUID();
        }
        if (policy instanceof FingerprintPolicy.SeverityBased) {
            return hash(event.eventType(), event.sourceId(), event.severity().name());
        }
        if (policy instanceof FingerprintPolicy.IssueBased) {
            List<String> parts = new ArrayList<>(List.of(event.eventType(), event.sourceId()));
            TreeSet<String> issues = new TreeSet<>(event.issueSignature());
            parts.add(String.valueOf(issues.size()));
            parts.addAll(issues);
            return hash(parts);
        }
        if (policy instanceof FingerprintPolicy.Strict) {
            return hash(canonicalize(event));
        }
        FingerprintPolicy.Custom custom = (FingerprintPolicy.Custom) policy;
        try {
            List<String> parts = new ArrayList<>(List.of("custom", custom.template()));
            parts.addAll(templateValues(custom.template(), event));
            return hash(parts);
        } catch (FingerprintEvaluationException e) {
            metricsConfig.getFingerprintFallbacks().increment();
            log.warn("Custom fingerprint failed, falling back to basic: template='{}', reason={}",
                    custom.template(), e.getMessage());
            return basic(event);
        }
    }

    private String basic(NotificationEvent event) {
        return hash(event.eventType(), event.sourceId());
    }

    /**
     * Resolved values of the template's placeholders, in order of appearance.
     *
     * @throws FingerprintEvaluationException for blank templates, unknown fields or missing payload keys
     */
    List<String> templateValues(String template, NotificationEvent event) {
        if (template == null || template.isBlank()) {
            throw new FingerprintEvaluationException("Template is empty", template);
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        List<String> values = new ArrayList<>();
        while (matcher.find()) {
            values.add(resolveField(matcher.group(1).trim(), event, template));
        }
        return values;
    }

    private String resolveField(String field, NotificationEvent event, String template) {
        switch (field) {
            case "event_type":
                return event.eventType();
            case "source_id":
                return event.sourceId();
            case "severity":
                return event.severity().toJson();
            case "issues":
                return String.join(",", new TreeSet<>(event.issueSignature()));
            default:
                break;
        }
        if (field.startsWith(PAYLOAD_PREFIX)) {
            String key = field.substring(PAYLOAD_PREFIX.length());
            Object value = event.payload().get(key);
            if (value == null) {
                throw new FingerprintEvaluationException("Payload key not present: " + key, template);
            }
            return String.valueOf(value);
        }
        throw new FingerprintEvaluationException("Unknown template field: " + field, template);
    }

    private String canonicalize(NotificationEvent event) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("event_type", event.eventType());
        doc.put("source_id", event.sourceId());
        doc.put("severity", event.severity().toJson());
        doc.put("issues", new ArrayList<>(new TreeSet<>(event.issueSignature())));
        doc.put("payload", event.payload());
        try {
            return CANONICAL_MAPPER.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Event payload is not serializable", e);
        }
    }

    static String hash(String... parts) {
        return hash(Arrays.asList(parts));
    }

    static String hash(List<String> parts) {
        StringBuilder encoded = new StringBuilder();
        for (String part : parts) {
            String value = String.valueOf(part);
            encoded.append(value.length()).append(':').append(value);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(encoded.toString().getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(bytes.length * 2);
            for (byte b : bytes) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
