package com.example.demo.factfind.value;

import com.example.demo.factfind.exception.FormValidationException;
import com.example.demo.factfind.model.FieldKind;
import com.example.demo.factfind.model.FormField;
import com.example.demo.factfind.model.FormTemplate;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Current answers for one form template, keyed by field key.
 *
 * <p>Value shapes per kind:
 * <ul>
 *   <li>text, textarea, number, date, select, calculated: {@code String} (default {@code ""})</li>
 *   <li>boolean: {@code Boolean} (default {@code false})</li>
 *   <li>multiselect: {@code List<String>} (default empty)</li>
 *   <li>repeater: {@code List<Map<String, Object>>} of items (default empty)</li>
 * </ul>
 * Calculated fields keep their placeholder value; their real value is derived on read by
 * the formula evaluator. Repeater sub-keys are never seeded at the top level.
 *
 * <p>Not thread-safe; owned by a single form session.
 */
@Slf4j
public class ValueStore {
    private final FormTemplate template;
    private final Map<String, FormField> fieldsByKey = new LinkedHashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();

    private ValueStore(FormTemplate template) {
        this.template = template;
        for (FormField field : template.getAllFields()) {
            fieldsByKey.put(field.getKey(), field);
        }
    }

    /**
     * A fresh store with the kind default for every field of the template.
     */
    public static ValueStore initialize(FormTemplate template) {
        ValueStore store = new ValueStore(template);
        for (FormField field : store.fieldsByKey.values()) {
            if (field.isRepeater()) {
                store.values.put(field.getKey(), RepeaterItems.create(field));
            } else {
                store.values.put(field.getKey(), defaultValue(field.getKind()));
            }
        }
        return store;
    }

    /**
     * A fresh store populated from externally supplied answers. Keys the template does not
     * know and calculated keys are ignored.
     */
    public static ValueStore of(FormTemplate template, Map<String, ?> supplied) {
        ValueStore store = initialize(template);
        if (supplied == null) return store;
        for (Map.Entry<String, ?> entry : supplied.entrySet()) {
            FormField field = store.fieldsByKey.get(entry.getKey());
            if (field == null || field.isCalculated()) {
                log.debug("Ignoring supplied value for '{}' in template {}", entry.getKey(), template.getId());
                continue;
            }
            store.set(entry.getKey(), entry.getValue());
        }
        return store;
    }

    public static Object defaultValue(FieldKind kind) {
        if (kind == FieldKind.BOOLEAN) return Boolean.FALSE;
        if (kind != null && kind.isListValued()) return List.of();
        return "";
    }

    public FormTemplate getTemplate() {
        return template;
    }

    public boolean hasField(String key) {
        return fieldsByKey.containsKey(key);
    }

    /**
     * Current value of a field, or the kind default. Lists are returned as snapshots.
     * Returns null for keys the template does not declare.
     */
    public Object get(String key) {
        FormField field = fieldsByKey.get(key);
        if (field == null) return null;
        Object value = values.get(key);
        if (value == null) return defaultValue(field.getKind());
        if (value instanceof RepeaterItems) return ((RepeaterItems) value).items();
        if (value instanceof List) return Collections.unmodifiableList(new ArrayList<>((List<?>) value));
        return value;
    }

    /**
     * All values in template order
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (String key : fieldsByKey.keySet()) {
            copy.put(key, get(key));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Replace the whole value of a field.
     */
    public void set(String key, Object value) {
        FormField field = requireEditable(key);
        switch (field.getKind()) {
            case BOOLEAN:
                values.put(key, toBoolean(value));
                break;
            case MULTISELECT:
                values.put(key, toSelections(key, value));
                break;
            case REPEATER:
                repeater(field).replaceAll(toItems(field, value));
                break;
            default:
                values.put(key, toText(key, value));
        }
    }

    /**
     * Replace one sub-field of one repeater item; the other items are left untouched.
     */
    public void updateItem(String repeaterKey, int index, String subKey, Object value) {
        FormField field = requireRepeater(repeaterKey);
        FormField sub = field.findSubField(subKey).orElseThrow(() -> new FormValidationException(
                FormValidationException.UNKNOWN_FIELD,
                "Repeater '" + repeaterKey + "' has no sub-field '" + subKey + "'"));
        repeater(field).updateItem(index, subKey, toSubValue(sub, value));
    }

    /**
     * Chip mode: add the item for a type value.
     *
     * @return false when the type is blank, unknown, already selected or the repeater is full
     */
    public boolean addTypedItem(String repeaterKey, String type) {
        return typed(repeaterKey).add(type);
    }

    /**
     * Chip mode: remove the item whose type matches.
     */
    public boolean removeTypedItem(String repeaterKey, String type) {
        return typed(repeaterKey).remove(type);
    }

    public List<String> selectedTypes(String repeaterKey) {
        return typed(repeaterKey).selectedTypes();
    }

    /**
     * Chip mode: type options that can still be added
     */
    public List<String> availableTypes(String repeaterKey) {
        return typed(repeaterKey).availableTypes();
    }

    public boolean isChipRepeater(String key) {
        FormField field = fieldsByKey.get(key);
        return field != null && field.getTypeSubField().isPresent();
    }

    /**
     * Count mode: grow or shrink the repeater, clamped to the field's min/max.
     *
     * @return the resulting number of items
     */
    public int setItemCount(String repeaterKey, int count) {
        RepeaterItems items = repeater(requireRepeater(repeaterKey));
        if (!(items instanceof IndexedRepeaterItems)) {
            throw new FormValidationException(FormValidationException.INVALID_VALUE,
                    "Items of '" + repeaterKey + "' are added by type");
        }
        return ((IndexedRepeaterItems) items).resize(count);
    }

    public boolean addSelection(String key, String option) {
        List<String> current = selections(key);
        if (option == null || option.isBlank() || current.contains(option)) return false;
        current.add(option);
        return true;
    }

    public boolean removeSelection(String key, String option) {
        return selections(key).remove(option);
    }

    public void clearSelections(String key) {
        selections(key).clear();
    }

    private FormField requireEditable(String key) {
        FormField field = fieldsByKey.get(key);
        if (field == null) {
            throw new FormValidationException(FormValidationException.UNKNOWN_FIELD,
                    "Template '" + template.getId() + "' has no field '" + key + "'");
        }
        if (field.isCalculated()) {
            throw new FormValidationException(FormValidationException.READ_ONLY_FIELD,
                    "Field '" + key + "' is calculated and cannot be edited");
        }
        return field;
    }

    private FormField requireRepeater(String key) {
        FormField field = requireEditable(key);
        if (!field.isRepeater()) {
            throw new FormValidationException(FormValidationException.INVALID_VALUE,
                    "Field '" + key + "' is not a repeater");
        }
        return field;
    }

    private RepeaterItems repeater(FormField field) {
        return (RepeaterItems) values.computeIfAbsent(field.getKey(), k -> RepeaterItems.create(field));
    }

    private TypedRepeaterItems typed(String repeaterKey) {
        RepeaterItems items = repeater(requireRepeater(repeaterKey));
        if (!(items instanceof TypedRepeaterItems)) {
            throw new FormValidationException(FormValidationException.INVALID_VALUE,
                    "Repeater '" + repeaterKey + "' has no type selector");
        }
        return (TypedRepeaterItems) items;
    }

    @SuppressWarnings("unchecked")
    private List<String> selections(String key) {
        FormField field = requireEditable(key);
        if (field.getKind() != FieldKind.MULTISELECT) {
            throw new FormValidationException(FormValidationException.INVALID_VALUE,
                    "Field '" + key + "' is not a multiselect");
        }
        Object current = values.get(key);
        if (!(current instanceof ArrayList)) {
            List<String> list = current instanceof List ? new ArrayList<>((List<String>) current) : new ArrayList<>();
            values.put(key, list);
            return list;
        }
        return (List<String>) current;
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof String) {
            String s = ((String) value).trim();
            return "true".equalsIgnoreCase(s) || "yes".equalsIgnoreCase(s);
        }
        return Boolean.FALSE;
    }

    private static String toText(String key, Object value) {
        if (value == null) return "";
        if (value instanceof String) return (String) value;
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d)) {
                return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            }
            return "";
        }
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        throw new FormValidationException(FormValidationException.INVALID_VALUE,
                "Field '" + key + "' expects a single value");
    }

    private static List<String> toSelections(String key, Object value) {
        if (value == null) return new ArrayList<>();
        if (value instanceof String) {
            String s = (String) value;
            List<String> single = new ArrayList<>();
            if (!s.isBlank()) single.add(s);
            return single;
        }
        if (!(value instanceof List)) {
            throw new FormValidationException(FormValidationException.INVALID_VALUE,
                    "Field '" + key + "' expects a list of options");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (Object element : (List<?>) value) {
            if (element == null) continue;
            String option = element.toString();
            if (!option.isBlank()) distinct.add(option);
        }
        return new ArrayList<>(distinct);
    }

    private static Object toSubValue(FormField sub, Object value) {
        if (sub.getKind() == FieldKind.MULTISELECT) return toSelections(sub.getKey(), value);
        if (sub.getKind() == FieldKind.BOOLEAN) return toBoolean(value);
        return toText(sub.getKey(), value);
    }

    /**
     * Items are checked against the declared sub-fields: undeclared keys are rejected and
     * each value is normalized for its sub-field kind.
     */
    private static List<Map<String, Object>> toItems(FormField field, Object value) {
        String key = field.getKey();
        List<Map<String, Object>> items = new ArrayList<>();
        if (value == null) return items;
        if (!(value instanceof List)) {
            throw new FormValidationException(FormValidationException.INVALID_VALUE,
                    "Field '" + key + "' expects a list of items");
        }
        for (Object element : (List<?>) value) {
            if (!(element instanceof Map)) {
                throw new FormValidationException(FormValidationException.INVALID_VALUE,
                        "Items of '" + key + "' must be objects");
            }
            Map<String, Object> item = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) element).entrySet()) {
                String subKey = String.valueOf(entry.getKey());
                FormField sub = field.findSubField(subKey).orElseThrow(() -> new FormValidationException(
                        FormValidationException.UNKNOWN_FIELD,
                        "Repeater '" + key + "' has no sub-field '" + subKey + "'"));
                item.put(subKey, toSubValue(sub, entry.getValue()));
            }
            items.add(item);
        }
        return items;
    }
}
