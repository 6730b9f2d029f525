package com.example.demo.factfind.value;

import com.example.demo.factfind.exception.FormValidationException;
import com.example.demo.factfind.model.FieldKind;
import com.example.demo.factfind.model.FormField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Items of one repeater field, exposed as an ordered list of sub-key to value maps.
 */
abstract class RepeaterItems {
    protected final FormField field;

    RepeaterItems(FormField field) {
        this.field = field;
    }

    static RepeaterItems create(FormField field) {
        return field.getTypeSubField().isPresent() ? new TypedRepeaterItems(field) : new IndexedRepeaterItems(field);
    }

    abstract List<Map<String, Object>> mutableItems();

    abstract void replaceAll(List<Map<String, Object>> items);

    int size() {
        return mutableItems().size();
    }

    void updateItem(int index, String subKey, Object value) {
        List<Map<String, Object>> items = mutableItems();
        if (index < 0 || index >= items.size()) {
            throw new FormValidationException(FormValidationException.UNKNOWN_ITEM,
                    "Repeater '" + field.getKey() + "' has no item at index " + index);
        }
        items.get(index).put(subKey, value);
    }

    /**
     * Snapshot of the items; neither the list nor the item maps are live.
     */
    List<Map<String, Object>> items() {
        List<Map<String, Object>> copy = new ArrayList<>();
        for (Map<String, Object> item : mutableItems()) {
            Map<String, Object> itemCopy = new LinkedHashMap<>();
            item.forEach((k, v) -> itemCopy.put(k, v instanceof List ? Collections.unmodifiableList(new ArrayList<>((List<?>) v)) : v));
            copy.add(Collections.unmodifiableMap(itemCopy));
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * A new item with an empty value for every sub-field.
     */
    protected Map<String, Object> blankItem() {
        Map<String, Object> item = new LinkedHashMap<>();
        for (FormField sub : field.getFields()) {
            item.put(sub.getKey(), sub.getKind() == FieldKind.MULTISELECT ? new ArrayList<String>() : "");
        }
        return item;
    }

    /**
     * A blank item overlaid with the supplied sub-field values.
     */
    protected Map<String, Object> completeItem(Map<String, Object> supplied) {
        Map<String, Object> item = blankItem();
        item.putAll(supplied);
        return item;
    }

    protected void checkCapacity(int requested) {
        if (requested > field.getMaxItems()) {
            throw new FormValidationException(FormValidationException.INVALID_VALUE,
                    "Repeater '" + field.getKey() + "' accepts at most " + field.getMaxItems() + " items");
        }
    }
}
