package com.example.demo.factfind.value;

import com.example.demo.factfind.model.FormField;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plain repeater: items are addressed by position and their number is chosen directly.
 */
class IndexedRepeaterItems extends RepeaterItems {
    private final List<Map<String, Object>> items = new ArrayList<>();

    IndexedRepeaterItems(FormField field) {
        super(field);
    }

    @Override
    List<Map<String, Object>> mutableItems() {
        return items;
    }

    @Override
    void replaceAll(List<Map<String, Object>> newItems) {
        checkCapacity(newItems.size());
        items.clear();
        for (Map<String, Object> item : newItems) {
            items.add(completeItem(item));
        }
    }

    /**
     * Grow with blank items or truncate so that the repeater holds {@code count} items,
     * clamped to the field's min/max.
     *
     * @return the resulting item count
     */
    int resize(int count) {
        int target = Math.max(field.getMinItems(), Math.min(field.getMaxItems(), count));
        while (items.size() < target) {
            items.add(blankItem());
        }
        while (items.size() > target) {
            items.remove(items.size() - 1);
        }
        return target;
    }
}
