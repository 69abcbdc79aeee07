package dev.shortcuts.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;

/**
 * Conversions between Jackson trees and scalar {@link ParameterValue}s.
 * Nested action lists are handled by the callers that know their JSON shape.
 */
public final class JsonValues {

    private JsonValues() {}

    /** Strings, finite numbers and booleans become typed values; anything else stays opaque. */
    public static ParameterValue toValue(JsonNode node) {
        if (node == null) {
            return new ParameterValue.Opaque(null);
        }
        if (node.isTextual()) {
            return new ParameterValue.Text(node.asText());
        }
        if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
            return new ParameterValue.Opaque(node.deepCopy());
        }
        if (node.isNumber()) {
            return new ParameterValue.Number(node.decimalValue());
        }
        if (node.isBoolean()) {
            return new ParameterValue.Bool(node.booleanValue());
        }
        return new ParameterValue.Opaque(node.deepCopy());
    }

    /**
     * Scalar and opaque values as JSON. Integral numbers are written without a fraction.
     *
     * @throws IllegalArgumentException for nested action lists
     */
    public static JsonNode toJson(ParameterValue value) {
        if (value instanceof ParameterValue.Text text) {
            return TextNode.valueOf(text.value());
        } else if (value instanceof ParameterValue.Number number) {
            return numberNode(number.value());
        } else if (value instanceof ParameterValue.Bool bool) {
            return BooleanNode.valueOf(bool.value());
        } else if (value instanceof ParameterValue.Opaque opaque) {
            return opaque.value().deepCopy();
        }
        throw new IllegalArgumentException("Not a scalar parameter value: " + value.kindName());
    }

    public static JsonNode numberNode(BigDecimal value) {
        BigDecimal stripped = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                long exact = stripped.longValueExact();
                return exact == (int) exact ? IntNode.valueOf((int) exact) : LongNode.valueOf(exact);
            } catch (ArithmeticException e) {
                return BigIntegerNode.valueOf(stripped.toBigIntegerExact());
            }
        }
        return DecimalNode.valueOf(stripped);
    }
}
