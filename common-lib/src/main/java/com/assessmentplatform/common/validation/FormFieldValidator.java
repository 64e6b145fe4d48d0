package com.assessmentplatform.common.validation;

import com.assessmentplatform.common.model.DynamicFormField;
import com.assessmentplatform.common.model.DynamicFormField.FieldType;
import com.assessmentplatform.common.model.ValidationRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks operator answers against the rules the field-assessor attached to the current
 * dynamic form.
 *
 * <p>Only submitted answers are checked. Fields the operator has not answered yet are the
 * field-assessor's concern when the step is validated. {@code CUSTOM} rules are opaque
 * here and always pass.
 *
 * <p>Stateless and thread-safe.
 */
public final class FormFieldValidator {

    private FormFieldValidator() {}

    /**
     * @param fields  the current dynamic form
     * @param answers submitted values keyed by field id; ids not on the form are not checked
     * @return human-readable violations in field order; empty when everything passes
     */
    public static List<String> validate(List<DynamicFormField> fields, Map<String, Object> answers) {
        List<String> violations = new ArrayList<>();
        for (DynamicFormField field : fields) {
            if (!answers.containsKey(field.id())) continue;
            violations.addAll(validateField(field, answers.get(field.id())));
        }
        return violations;
    }

    static List<String> validateField(DynamicFormField field, Object value) {
        String label = field.label() != null ? field.label() : field.id();
        List<String> violations = new ArrayList<>();

        if (isBlank(value)) {
            if (field.required()) {
                violations.add(messageFor(field, ValidationRule.RuleType.REQUIRED, label + " is required"));
            }
            return violations;
        }

        Double number = null;
        if (field.type() != null && field.type().isNumeric()) {
            number = toNumber(value);
            if (number == null) {
                violations.add(label + " must be a number");
                return violations;
            }
        }

        if (field.type() == FieldType.SELECT && field.options() != null
                && !field.options().contains(String.valueOf(value))) {
            violations.add(label + " must be one of " + field.options());
        }
        if (field.type() == FieldType.MULTI_SELECT && field.options() != null) {
            if (!(value instanceof Collection<?> selected)) {
                violations.add(label + " must be a list of choices");
            } else if (!selected.stream().map(String::valueOf).allMatch(field.options()::contains)) {
                violations.add(label + " must be chosen from " + field.options());
            }
        }

        for (ValidationRule rule : field.validationRules()) {
            if (rule.type() == null) continue;
            switch (rule.type()) {
                case MIN -> {
                    Double bound = toNumber(rule.value());
                    Double actual = number != null ? number : toNumber(value);
                    if (bound != null && actual != null && actual < bound) {
                        violations.add(orDefault(rule, label + " must be at least " + rule.value()));
                    }
                }
                case MAX -> {
                    Double bound = toNumber(rule.value());
                    Double actual = number != null ? number : toNumber(value);
                    if (bound != null && actual != null && actual > bound) {
                        violations.add(orDefault(rule, label + " must be at most " + rule.value()));
                    }
                }
                case PATTERN -> {
                    if (rule.value() != null && !matches(String.valueOf(rule.value()), String.valueOf(value))) {
                        violations.add(orDefault(rule, label + " has an invalid format"));
                    }
                }
                case REQUIRED, CUSTOM -> { }
            }
        }
        return violations;
    }

    /** Parses numbers and numeric strings; {@code null} when the value is not numeric. */
    public static Double toNumber(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean matches(String regex, String value) {
        try {
            return Pattern.compile(regex).matcher(value).matches();
        } catch (PatternSyntaxException e) {
            // a broken specialist pattern cannot be held against the operator
            return true;
        }
    }

    private static boolean isBlank(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isBlank();
        if (value instanceof Collection<?> c) return c.isEmpty();
        return false;
    }

    private static String messageFor(DynamicFormField field, ValidationRule.RuleType type, String fallback) {
        return field.validationRules().stream()
            .filter(r -> r.type() == type && r.message() != null && !r.message().isBlank())
            .map(ValidationRule::message)
            .findFirst()
            .orElse(fallback);
    }

    private static String orDefault(ValidationRule rule, String fallback) {
        return rule.message() != null && !rule.message().isBlank() ? rule.message() : fallback;
    }
}
