package com.example.demo.factfind.formula;

import com.example.demo.factfind.model.CalculatedValue;
import com.example.demo.factfind.model.FormField;
import com.example.demo.factfind.model.FormTemplate;
import com.example.demo.factfind.model.Formula;
import com.example.demo.factfind.model.FormulaType;
import com.example.demo.factfind.model.RepeaterSource;
import com.example.demo.factfind.value.ValueStore;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes calculated fields from the current values of a form.
 *
 * <p>Two formula kinds are supported:
 * <ul>
 *   <li><b>sum</b> (the default): the listed fields plus every listed repeater sub-field
 *   across all items of that repeater</li>
 *   <li><b>ratio</b>: the summed numerator fields divided by the denominator field, times
 *   the multiplier; a zero denominator gives zero</li>
 * </ul>
 * Missing or unparseable inputs count as 0. Results are fixed-decimal strings rounded
 * half-up. Evaluation is pure: the same store always gives the same result, and nothing
 * is cached.
 */
@Component
public class FormulaEvaluator {
    private static final Locale DISPLAY_LOCALE = Locale.forLanguageTag("en-AU");

    public String evaluate(Formula formula, ValueStore store) {
        int decimals = formula.getEffectiveDecimals();
        if (formula.getEffectiveType() == FormulaType.RATIO) {
            double numerator = sumOf(formula.getNumeratorFields(), store);
            double denominator = NumericValues.parseOrZero(store.get(formula.getDenominatorField()));
            if (denominator == 0d) {
                return toFixed(0d, decimals);
            }
            return toFixed(numerator / denominator * formula.getEffectiveMultiplier(), decimals);
        }
        double sum = sumOf(formula.getFields(), store);
        for (RepeaterSource source : formula.getRepeaters()) {
            sum += sumOfItems(source, store);
        }
        return toFixed(sum, decimals);
    }

    /**
     * Value of one calculated field. A field without a formula reads as {@code "0.00"}.
     */
    public String evaluate(FormField field, ValueStore store) {
        if (field.getFormula() == null) {
            return toFixed(0d, Formula.DEFAULT_DECIMALS);
        }
        return evaluate(field.getFormula(), store);
    }

    /**
     * Every calculated field of the template, in declaration order.
     */
    public Map<String, CalculatedValue> evaluateAll(FormTemplate template, ValueStore store) {
        Map<String, CalculatedValue> result = new LinkedHashMap<>();
        for (FormField field : template.getCalculatedFields()) {
            String value = evaluate(field, store);
            result.put(field.getKey(), new CalculatedValue(value, formatForDisplay(value, field.getSuffix())));
        }
        return result;
    }

    /**
     * Grouped two-decimal rendering, e.g. {@code 1,234.50} or {@code 84.71 %}.
     */
    public String formatForDisplay(String value, String suffix) {
        NumberFormat format = NumberFormat.getNumberInstance(DISPLAY_LOCALE);
        format.setMinimumFractionDigits(2);
        format.setMaximumFractionDigits(2);
        format.setRoundingMode(RoundingMode.HALF_UP);
        String formatted = format.format(NumericValues.parseOrZero(value));
        return suffix == null || suffix.isEmpty() ? formatted : formatted + " " + suffix;
    }

    static String toFixed(double value, int decimals) {
        if (!Double.isFinite(value)) {
            value = 0d;
        }
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }

    private static double sumOf(List<String> keys, ValueStore store) {
        double sum = 0d;
        for (String key : keys) {
            sum += NumericValues.parseOrZero(store.get(key));
        }
        return sum;
    }

    private static double sumOfItems(RepeaterSource source, ValueStore store) {
        Object items = store.get(source.getKey());
        if (!(items instanceof List)) return 0d;
        double sum = 0d;
        for (Object item : (List<?>) items) {
            if (item instanceof Map) {
                sum += NumericValues.parseOrZero(((Map<?, ?>) item).get(source.getSubKey()));
            }
        }
        return sum;
    }
}
