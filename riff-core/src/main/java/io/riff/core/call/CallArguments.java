package io.riff.core.call;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public final class CallArguments {
    private static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";

    private final Map<String, Object> values;

    public CallArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public String requireString(String key) throws CodeBuildException {
        return optionalString(key).orElseThrow(() -> new CodeBuildException("Missing required argument: " + key));
    }

    public Optional<String> optionalString(String key) throws CodeBuildException {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(formatNumber(number));
        }
        if (!(value instanceof String text)) {
            throw new CodeBuildException("Argument " + key + " must be a string");
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    public String requireIdentifier(String key) throws CodeBuildException {
        String value = requireString(key);
        if (!value.matches(IDENTIFIER)) {
            throw new CodeBuildException("Argument " + key + " is not a valid name: " + value);
        }
        return value;
    }

    public int requireInteger(String key) throws CodeBuildException {
        return optionalInteger(key).orElseThrow(() -> new CodeBuildException("Missing required argument: " + key));
    }

    public Optional<Integer> optionalInteger(String key) throws CodeBuildException {
        Optional<BigDecimal> number = optionalDecimal(key);
        if (number.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(number.get().intValueExact());
        } catch (ArithmeticException e) {
            throw new CodeBuildException("Argument " + key + " must be an integer");
        }
    }

    public Optional<Double> optionalDouble(String key) throws CodeBuildException {
        return optionalDecimal(key).map(BigDecimal::doubleValue);
    }

    /**
     * Pitch sequence in runtime list syntax. Accepts either the literal text or a JSON array
     * whose elements are numbers or nested arrays (chords).
     */
    public String requirePitchSequence(String key) throws CodeBuildException {
        Object value = values.get(key);
        if (value == null) {
            throw new CodeBuildException("Missing required argument: " + key);
        }
        if (value instanceof Collection<?> items) {
            return renderSequence(key, items, '[', ']');
        }
        if (value instanceof Number number) {
            return "[" + formatNumber(number) + "]";
        }
        String text = requireString(key);
        if (!text.matches("[-0-9.,\\s\\[\\]()]+") || !text.matches(".*[0-9].*")) {
            throw new CodeBuildException("Argument " + key + " is not a pitch sequence: " + text);
        }
        return text;
    }

    public Map<String, Object> effects(String key) throws CodeBuildException {
        Object value = values.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new CodeBuildException("Argument " + key + " must be an object");
        }
        Map<String, Object> effects = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (!name.matches(IDENTIFIER)) {
                throw new CodeBuildException("Invalid effect name: " + name);
            }
            Object effectValue = entry.getValue();
            if (effectValue == null) {
                continue;
            }
            if (!(effectValue instanceof Number) && !(effectValue instanceof String)) {
                throw new CodeBuildException("Effect " + name + " must be a number or string");
            }
            effects.put(name, effectValue);
        }
        return effects;
    }

    public static String formatNumber(Number number) {
        if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return String.valueOf(d);
        }
        if (number instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return String.valueOf(f);
        }
        BigDecimal decimal = new BigDecimal(number.toString()).stripTrailingZeros();
        if (decimal.scale() <= 0) {
            return decimal.toBigInteger().toString();
        }
        return decimal.toPlainString();
    }

    public static String formatValue(Object value) {
        if (value instanceof Number number) {
            return formatNumber(number);
        }
        String text = String.valueOf(value);
        if (text.matches("-?[0-9.]+") || text.matches("[\\[(].*[\\])]")) {
            return text;
        }
        return "\"" + text.replace("\"", "") + "\"";
    }

    private Optional<BigDecimal> optionalDecimal(String key) throws CodeBuildException {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        try {
            if (value instanceof Number number) {
                return Optional.of(new BigDecimal(number.toString()));
            }
            if (value instanceof String text && !text.isBlank()) {
                return Optional.of(new BigDecimal(text.trim()));
            }
        } catch (NumberFormatException e) {
            throw new CodeBuildException("Argument " + key + " must be a number");
        }
        throw new CodeBuildException("Argument " + key + " must be a number");
    }

    private String renderSequence(String key, Collection<?> items, char open, char close) throws CodeBuildException {
        StringBuilder out = new StringBuilder().append(open);
        boolean first = true;
        for (Object item : items) {
            if (!first) {
                out.append(", ");
            }
            first = false;
            if (item instanceof Number number) {
                out.append(formatNumber(number));
            } else if (item instanceof Collection<?> chord) {
                out.append(renderSequence(key, chord, '(', ')'));
            } else {
                throw new CodeBuildException("Argument " + key + " contains a non-numeric pitch: " + item);
            }
        }
        return out.append(close).toString();
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", ", "{", "}"));
    }
}
