package com.lanhub.collector.intake.merge;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One value of a submitted JSON record.
 */
public interface FieldValue {

    String asText();

    default OptionalDouble asNumber() {
        return OptionalDouble.empty();
    }

    default Optional<Boolean> asBoolean() {
        return Optional.empty();
    }

    default boolean isBlank() {
        return asText().isBlank();
    }

    static FieldValue of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isNumber()) {
            return new NumberValue(node.decimalValue());
        }
        if (node.isBoolean()) {
            return new BooleanValue(node.booleanValue());
        }
        if (node.isTextual()) {
            return new TextValue(node.textValue());
        }
        return new TextValue(node.toString());
    }

    record NumberValue(BigDecimal value) implements FieldValue {
        @Override
        public String asText() {
            BigDecimal stripped = value.stripTrailingZeros();
            return stripped.scale() < 0 ? stripped.setScale(0).toPlainString() : stripped.toPlainString();
        }

        @Override
        public OptionalDouble asNumber() {
            return OptionalDouble.of(value.doubleValue());
        }
    }

    record TextValue(String value) implements FieldValue {
        public TextValue {
            value = value == null ? "" : value;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public OptionalDouble asNumber() {
            String trimmed = value.trim();
            if (trimmed.isEmpty()) {
                return OptionalDouble.empty();
            }
            try {
                double parsed = Double.parseDouble(trimmed);
                return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }

        @Override
        public Optional<Boolean> asBoolean() {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("是")) {
                return Optional.of(Boolean.TRUE);
            }
            if (normalized.equals("false") || normalized.equals("否")) {
                return Optional.of(Boolean.FALSE);
            }
            return Optional.empty();
        }
    }

    record BooleanValue(boolean value) implements FieldValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public Optional<Boolean> asBoolean() {
            return Optional.of(value);
        }
    }

    record NullValue() implements FieldValue {
        public static final NullValue INSTANCE = new NullValue();

        @Override
        public String asText() {
            return "";
        }
    }
}
