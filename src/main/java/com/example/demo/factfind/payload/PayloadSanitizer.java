package com.example.demo.factfind.payload;

import com.example.demo.factfind.formula.NumericValues;
import com.example.demo.factfind.model.FieldKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns raw form values into the payload sent to the generation service.
 *
 * <ul>
 *   <li>calculated: always present, as a double (unparseable reads as 0)</li>
 *   <li>multiselect: joined with {@code ", "}; omitted when nothing is selected</li>
 *   <li>repeater: sub-values trimmed, empty ones dropped, items left with no sub-value
 *   dropped; omitted when no item survives</li>
 *   <li>strings: trimmed; omitted when empty</li>
 *   <li>anything else: passed through unless null or an empty list</li>
 * </ul>
 * Sanitizing a sanitized payload gives the same payload.
 */
@Slf4j
@Component
public class PayloadSanitizer {
    public static final String MULTISELECT_SEPARATOR = ", ";

    public SubmissionPayload sanitize(Map<String, ?> values, Map<String, FieldKind> kinds) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (values != null) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                Object value = entry.getValue();
                if (value == null) continue;
                FieldKind kind = kinds.get(entry.getKey());
                Object sanitized = sanitizeValue(kind, value);
                if (sanitized != null) {
                    payload.put(entry.getKey(), sanitized);
                }
            }
        }
        kinds.forEach((key, kind) -> {
            if (kind == FieldKind.CALCULATED && !payload.containsKey(key)) {
                payload.put(key, 0d);
            }
        });
        log.debug("Sanitized {} raw values into {} payload entries", values == null ? 0 : values.size(), payload.size());
        return new SubmissionPayload(payload);
    }

    public SubmissionPayload sanitize(SubmissionPayload payload, Map<String, FieldKind> kinds) {
        return sanitize(payload.getValues(), kinds);
    }

    private Object sanitizeValue(FieldKind kind, Object value) {
        if (kind == FieldKind.CALCULATED) {
            return NumericValues.parseOrZero(value);
        }
        if (kind == FieldKind.MULTISELECT && value instanceof Collection) {
            Collection<?> selections = (Collection<?>) value;
            if (selections.isEmpty()) return null;
            return selections.stream().map(String::valueOf).collect(Collectors.joining(MULTISELECT_SEPARATOR));
        }
        if (kind == FieldKind.REPEATER) {
            return value instanceof Collection ? sanitizeItems((Collection<?>) value) : null;
        }
        return trimmedOrNull(value);
    }

    private List<Map<String, Object>> sanitizeItems(Collection<?> items) {
        List<Map<String, Object>> cleaned = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof Map)) continue;
            Map<String, Object> out = new LinkedHashMap<>();
            ((Map<?, ?>) item).forEach((k, v) -> {
                Object kept = trimmedOrNull(v);
                if (kept != null) out.put(String.valueOf(k), kept);
            });
            if (!out.isEmpty()) cleaned.add(out);
        }
        return cleaned.isEmpty() ? null : cleaned;
    }

    private static Object trimmedOrNull(Object value) {
        if (value == null) return null;
        if (value instanceof String) {
            String trimmed = ((String) value).strip();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (value instanceof Collection && ((Collection<?>) value).isEmpty()) return null;
        return value;
    }
}
