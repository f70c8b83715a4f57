package fr.lapetina.synapse.gateway.domain.profile;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Validates and normalizes profile values against a model's schema.
 *
 * Validates:
 * - Every key is a field of the model's family
 * - Numbers are finite and inside the field range
 * - Integers carry no fractional part
 * - Enum values are one of the field choices (case-insensitive)
 *
 * A null value means "unset". Blank strings are treated the same way.
 */
public final class ProfileValidator {

    private ProfileValidator() {
    }

    /**
     * Returns a normalized copy of the values, keeping nulls so that a merge-patch can delete keys.
     *
     * @throws RequestValidationException on the first invalid entry
     */
    public static Map<String, Object> validate(ProfileSchema schema, Map<String, Object> values) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (values == null) {
            return normalized;
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String name = entry.getKey();
            ProfileField field = schema.field(name).orElseThrow(() -> new RequestValidationException(
                    "Unknown profile field '" + name + "' for model family " + schema.family().getWireName()));
            normalized.put(name, normalize(field, entry.getValue()));
        }
        return normalized;
    }

    private static Object normalize(ProfileField field, Object value) {
        if (value == null) {
            return null;
        }
        switch (field.type()) {
            case STRING:
                return normalizeString(field, value);
            case NUMBER:
                return normalizeNumber(field, value);
            case INTEGER:
                return normalizeInteger(field, value);
            case ENUM:
                return normalizeChoice(field, value);
            default:
                throw new IllegalStateException("Unhandled field type: " + field.type());
        }
    }

    private static Object normalizeString(ProfileField field, Object value) {
        if (!(value instanceof String)) {
            throw new RequestValidationException(field.label() + " must be a string");
        }
        String text = (String) value;
        return text.isBlank() ? null : text;
    }

    private static Object normalizeNumber(ProfileField field, Object value) {
        double number = toDouble(field, value);
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new RequestValidationException(field.label() + " must be a finite number");
        }
        checkRange(field, number);
        return number;
    }

    private static Object normalizeInteger(ProfileField field, Object value) {
        double number = toDouble(field, value);
        if (Double.isNaN(number) || Double.isInfinite(number) || number != Math.rint(number)) {
            throw new RequestValidationException(field.label() + " must be an integer");
        }
        checkRange(field, number);
        return (long) number;
    }

    private static Object normalizeChoice(ProfileField field, Object value) {
        if (!(value instanceof String) && !(value instanceof Boolean)) {
            throw new RequestValidationException(field.label() + " must be one of " + field.choices());
        }
        String choice = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (choice.isEmpty()) {
            return null;
        }
        if (!field.choices().contains(choice)) {
            throw new RequestValidationException(field.label() + " must be one of " + field.choices());
        }
        return choice;
    }

    private static double toDouble(ProfileField field, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return new BigDecimal(((String) value).trim()).doubleValue();
            } catch (NumberFormatException e) {
                throw new RequestValidationException(field.label() + " must be a number", e);
            }
        }
        throw new RequestValidationException(field.label() + " must be a number");
    }

    private static void checkRange(ProfileField field, double number) {
        if (field.min() != null && number < field.min().doubleValue()) {
            throw new RequestValidationException(field.label() + " must be >= " + field.min());
        }
        if (field.max() != null && number > field.max().doubleValue()) {
            throw new RequestValidationException(field.label() + " must be <= " + field.max());
        }
    }
}
