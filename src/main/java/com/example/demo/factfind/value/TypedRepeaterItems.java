package com.example.demo.factfind.value;

import com.example.demo.factfind.exception.FormValidationException;
import com.example.demo.factfind.model.FormField;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Chip-driven repeater. Items are keyed by the value of their {@code type} sub-field,
 * so there is at most one item per type; insertion order is the display order.
 */
class TypedRepeaterItems extends RepeaterItems {
    private final LinkedHashMap<String, Map<String, Object>> itemsByType = new LinkedHashMap<>();
    private final List<String> typeOptions;

    TypedRepeaterItems(FormField field) {
        super(field);
        this.typeOptions = field.getTypeSubField().map(FormField::getOptions).orElse(List.of());
    }

    @Override
    List<Map<String, Object>> mutableItems() {
        return new ArrayList<>(itemsByType.values());
    }

    @Override
    void replaceAll(List<Map<String, Object>> newItems) {
        checkCapacity(newItems.size());
        LinkedHashMap<String, Map<String, Object>> rebuilt = new LinkedHashMap<>();
        for (Map<String, Object> item : newItems) {
            Object type = item.get(FormField.TYPE_SUBFIELD_KEY);
            if (!(type instanceof String) || ((String) type).isBlank()) {
                throw new FormValidationException(FormValidationException.INVALID_VALUE,
                        "Every item of '" + field.getKey() + "' needs a type");
            }
            if (!typeOptions.contains(type)) {
                throw new FormValidationException(FormValidationException.INVALID_VALUE,
                        "Type '" + type + "' is not an option of '" + field.getKey() + "'");
            }
            if (rebuilt.putIfAbsent((String) type, completeItem(item)) != null) {
                throw new FormValidationException(FormValidationException.INVALID_VALUE,
                        "Type '" + type + "' appears more than once in '" + field.getKey() + "'");
            }
        }
        itemsByType.clear();
        itemsByType.putAll(rebuilt);
    }

    @Override
    void updateItem(int index, String subKey, Object value) {
        if (FormField.TYPE_SUBFIELD_KEY.equals(subKey)) {
            throw new FormValidationException(FormValidationException.READ_ONLY_FIELD,
                    "The type of a '" + field.getKey() + "' item is controlled by its chip");
        }
        super.updateItem(index, subKey, value);
    }

    /**
     * Add an item for the given type. Ignored when the type is blank, not one of the
     * options, already present, or the repeater is full.
     */
    boolean add(String type) {
        if (type == null || type.isBlank()) return false;
        if (!typeOptions.contains(type)) return false;
        if (itemsByType.containsKey(type)) return false;
        if (itemsByType.size() >= field.getMaxItems()) return false;
        Map<String, Object> item = blankItem();
        item.put(FormField.TYPE_SUBFIELD_KEY, type);
        itemsByType.put(type, item);
        return true;
    }

    boolean remove(String type) {
        return type != null && itemsByType.remove(type) != null;
    }

    List<String> selectedTypes() {
        return List.copyOf(itemsByType.keySet());
    }

    List<String> availableTypes() {
        return typeOptions.stream().filter(opt -> !itemsByType.containsKey(opt)).collect(Collectors.toList());
    }
}
