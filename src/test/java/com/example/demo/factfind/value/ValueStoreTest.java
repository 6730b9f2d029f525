package com.example.demo.factfind.value;

import com.example.demo.factfind.FormTemplateFixtures;
import com.example.demo.factfind.exception.FormValidationException;
import com.example.demo.factfind.model.FormTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueStoreTest {

    private FormTemplate template;
    private ValueStore store;

    @BeforeEach
    public void setUp() {
        template = FormTemplateFixtures.lvrCheck();
        store = ValueStore.initialize(template);
    }

    @Test
    public void testInitializeSeedsKindDefaultsForTopLevelFields() {
        assertEquals("", store.get("loan_amount"));
        assertEquals("", store.get("purpose"));
        assertEquals("", store.get("lvr"));
        assertEquals(Boolean.FALSE, store.get("first_home_buyer"));
        assertEquals(List.of(), store.get("features"));
        assertEquals(List.of(), store.get("other_incomes"));

        Map<String, Object> snapshot = store.snapshot();
        assertEquals(template.getAllFields().size(), snapshot.size());
        assertFalse(snapshot.containsKey("source"), "repeater sub-keys are not seeded");
        assertFalse(snapshot.containsKey("amount"));
    }

    @Test
    public void testGetUnknownKeyReturnsNull() {
        assertNull(store.get("nope"));
    }

    @Test
    public void testSetNormalizesPerKind() {
        store.set("loan_amount", 720000);
        store.set("property_value", 850000.0);
        store.set("first_home_buyer", "Yes");
        store.set("features", List.of("Fixed Rate", "Redraw", "Fixed Rate", " "));

        assertEquals("720000", store.get("loan_amount"));
        assertEquals("850000", store.get("property_value"));
        assertEquals(Boolean.TRUE, store.get("first_home_buyer"));
        assertEquals(List.of("Fixed Rate", "Redraw"), store.get("features"));

        store.set("first_home_buyer", "no");
        assertEquals(Boolean.FALSE, store.get("first_home_buyer"));
        store.set("notes", null);
        assertEquals("", store.get("notes"));
    }

    @Test
    public void testCalculatedAndUnknownFieldsAreRejected() {
        FormValidationException readOnly = assertThrows(FormValidationException.class, () -> store.set("lvr", "12"));
        assertEquals(FormValidationException.READ_ONLY_FIELD, readOnly.getCode());

        FormValidationException unknown = assertThrows(FormValidationException.class, () -> store.set("missing", "x"));
        assertEquals(FormValidationException.UNKNOWN_FIELD, unknown.getCode());
    }

    @Test
    public void testSnapshotIsNotLive() {
        store.addSelection("features", "Redraw");
        @SuppressWarnings("unchecked")
        List<String> features = (List<String>) store.get("features");

        store.addSelection("features", "Offset Account");

        assertEquals(List.of("Redraw"), features);
        assertThrows(UnsupportedOperationException.class, () -> features.add("Fixed Rate"));
    }

    @Test
    public void testRepeaterItemUpdateLeavesOtherItemsUntouched() {
        store.set("other_incomes", List.of(
                Map.of("source", "Rental", "amount", "1200"),
                Map.of("source", "Dividends", "amount", "300")));

        store.updateItem("other_incomes", 1, "amount", "450");

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> items = (List<Map<String, Object>>) store.get("other_incomes");
        assertEquals(2, items.size());
        assertEquals("1200", items.get(0).get("amount"));
        assertEquals("Rental", items.get(0).get("source"));
        assertEquals("450", items.get(1).get("amount"));
        assertEquals("Dividends", items.get(1).get("source"));
    }

    @Test
    public void testRepeaterItemUpdateOutOfRange() {
        FormValidationException e = assertThrows(FormValidationException.class,
                () -> store.updateItem("other_incomes", 0, "amount", "1"));
        assertEquals(FormValidationException.UNKNOWN_ITEM, e.getCode());

        FormValidationException sub = assertThrows(FormValidationException.class,
                () -> store.updateItem("other_incomes", 0, "nope", "1"));
        assertEquals(FormValidationException.UNKNOWN_FIELD, sub.getCode());
    }

    @Test
    public void testItemCountIsClampedToMax() {
        assertEquals(2, store.setItemCount("other_incomes", 2));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> items = (List<Map<String, Object>>) store.get("other_incomes");
        assertEquals(2, items.size());
        assertEquals("", items.get(0).get("source"));
        assertEquals("", items.get(0).get("amount"));

        assertEquals(3, store.setItemCount("other_incomes", 9));
        assertEquals(0, store.setItemCount("other_incomes", -4));
    }

    @Test
    public void testItemCountShrinkKeepsLeadingItems() {
        store.setItemCount("other_incomes", 3);
        store.updateItem("other_incomes", 0, "source", "Rental");
        store.updateItem("other_incomes", 2, "source", "Dividends");

        store.setItemCount("other_incomes", 1);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> items = (List<Map<String, Object>>) store.get("other_incomes");
        assertEquals(1, items.size());
        assertEquals("Rental", items.get(0).get("source"));
    }

    @Test
    public void testChipModeAddTwoRemoveOne() {
        assertTrue(store.isChipRepeater("stages"));
        assertFalse(store.isChipRepeater("other_incomes"));

        assertTrue(store.addTypedItem("stages", "Slab"));
        assertTrue(store.addTypedItem("stages", "Frame"));
        store.updateItem("stages", 1, "amount", "90000");
        store.updateItem("stages", 1, "notes", "framing");

        assertTrue(store.removeTypedItem("stages", "Slab"));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> items = (List<Map<String, Object>>) store.get("stages");
        assertEquals(1, items.size());
        assertEquals("Frame", items.get(0).get("type"));
        assertEquals("90000", items.get(0).get("amount"));
        assertEquals("framing", items.get(0).get("notes"));
        assertEquals(List.of("Slab", "Lock-Up"), store.availableTypes("stages"));
    }

    @Test
    public void testChipModeIgnoresDuplicatesUnknownBlankAndFull() {
        assertTrue(store.addTypedItem("stages", "Slab"));
        assertFalse(store.addTypedItem("stages", "Slab"));
        assertFalse(store.addTypedItem("stages", "Roof"));
        assertFalse(store.addTypedItem("stages", " "));
        assertTrue(store.addTypedItem("stages", "Frame"));
        assertFalse(store.addTypedItem("stages", "Lock-Up"), "max is 2");

        assertEquals(List.of("Slab", "Frame"), store.selectedTypes("stages"));
    }

    @Test
    public void testChipTypeCannotBeEditedThroughItemUpdate() {
        store.addTypedItem("stages", "Slab");

        FormValidationException e = assertThrows(FormValidationException.class,
                () -> store.updateItem("stages", 0, "type", "Frame"));
        assertEquals(FormValidationException.READ_ONLY_FIELD, e.getCode());
    }

    @Test
    public void testChipRepeaterReplacementRejectsDuplicateTypes() {
        FormValidationException e = assertThrows(FormValidationException.class, () -> store.set("stages", List.of(
                Map.of("type", "Slab"),
                Map.of("type", "Slab"))));
        assertEquals(FormValidationException.INVALID_VALUE, e.getCode());
        assertEquals(List.of(), store.get("stages"));
    }

    @Test
    public void testChipRepeaterReplacementRejectsTypesOutsideTheOptions() {
        FormValidationException e = assertThrows(FormValidationException.class, () -> store.set("stages", List.of(
                Map.of("type", "Slab"),
                Map.of("type", "Roof"))));
        assertEquals(FormValidationException.INVALID_VALUE, e.getCode());
        assertEquals(List.of(), store.get("stages"));
        assertEquals(List.of("Slab", "Frame", "Lock-Up"), store.availableTypes("stages"));
    }

    @Test
    public void testRepeaterReplacementRejectsUndeclaredSubKeys() {
        FormValidationException indexed = assertThrows(FormValidationException.class, () -> store.set("other_incomes",
                List.of(Map.of("source", "Rental", "amount", "1200", "secret", "x"))));
        assertEquals(FormValidationException.UNKNOWN_FIELD, indexed.getCode());
        assertEquals(List.of(), store.get("other_incomes"));

        FormValidationException typed = assertThrows(FormValidationException.class, () -> store.set("stages",
                List.of(Map.of("type", "Slab", "colour", "red"))));
        assertEquals(FormValidationException.UNKNOWN_FIELD, typed.getCode());
    }

    @Test
    public void testRepeaterReplacementFillsAndNormalizesSubFields() {
        store.set("stages", List.of(Map.of("type", "Frame", "amount", 42000)));
        store.set("other_incomes", List.of(Map.of("amount", 1200.5)));

        @SuppressWarnings("unchecked")
        Map<String, Object> stage = ((List<Map<String, Object>>) store.get("stages")).get(0);
        assertEquals("Frame", stage.get("type"));
        assertEquals("42000", stage.get("amount"));
        assertEquals("", stage.get("notes"));
        assertEquals(List.of("Slab", "Lock-Up"), store.availableTypes("stages"));

        @SuppressWarnings("unchecked")
        Map<String, Object> income = ((List<Map<String, Object>>) store.get("other_incomes")).get(0);
        assertEquals("", income.get("source"));
        assertEquals("1200.5", income.get("amount"));
    }

    @Test
    public void testMultiselectHelpers() {
        assertTrue(store.addSelection("features", "Redraw"));
        assertFalse(store.addSelection("features", "Redraw"));
        assertFalse(store.addSelection("features", ""));
        assertTrue(store.addSelection("features", "Fixed Rate"));
        assertTrue(store.removeSelection("features", "Redraw"));
        assertEquals(List.of("Fixed Rate"), store.get("features"));

        store.clearSelections("features");
        assertEquals(List.of(), store.get("features"));
    }

    @Test
    public void testOfIgnoresUnknownAndCalculatedKeys() {
        ValueStore seeded = ValueStore.of(template, Map.of(
                "loan_amount", "500000",
                "lvr", "99",
                "unknown", "x"));

        assertEquals("500000", seeded.get("loan_amount"));
        assertEquals("", seeded.get("lvr"));
        assertNull(seeded.get("unknown"));
    }
}
