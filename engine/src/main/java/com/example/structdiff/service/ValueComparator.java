package com.example.structdiff.service;

import com.example.structdiff.model.ChangeEntry;
import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.model.CustomComparator;
import com.example.structdiff.model.DiffPath;
import com.example.structdiff.model.Verdict;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Scalar equality, shape compatibility and the custom comparator hook.
 */
@Slf4j
public class ValueComparator {

    /**
     * Consults the configured {@link CustomComparator}, if any.
     *
     * @return the changes to use instead of the default comparison, or empty to fall through
     */
    public Optional<List<ChangeEntry>> custom(DiffPath path, JsonNode left, JsonNode right, ComparisonOptions options) {
        CustomComparator comparator = options.getComparator();
        if (comparator == null) return Optional.empty();

        Verdict verdict = comparator.compare(path, left, right);
        if (verdict == null) return Optional.empty();
        return switch (verdict.kind()) {
            case EQUAL -> Optional.of(List.of());
            case NOT_EQUAL -> Optional.of(List.of(ChangeEntry.modify(path, left, right)));
            case REPLACE -> Optional.of(verdict.changes());
            case DEFER -> Optional.empty();
        };
    }

    /**
     * Whether two non-null values may be compared structurally. Containers must share their kind;
     * scalars must share their type, except that numbers of any representation are comparable when
     * {@code strict} is off. In strict mode integral and floating point numbers are not comparable.
     */
    public boolean comparable(JsonNode left, JsonNode right, ComparisonOptions options) {
        if (left.isObject() || right.isObject()) return left.isObject() && right.isObject();
        if (left.isArray() || right.isArray()) return left.isArray() && right.isArray();
        if (left.isNumber() && right.isNumber()) {
            return !options.isStrict() || left.isIntegralNumber() == right.isIntegralNumber();
        }
        return left.getNodeType() == right.getNodeType();
    }

    /** Default equality of two comparable scalars. */
    public boolean equal(JsonNode left, JsonNode right, ComparisonOptions options) {
        if (left.isNumber() && right.isNumber()) {
            if (!finite(left) || !finite(right)) {
                return Double.compare(left.doubleValue(), right.doubleValue()) == 0;
            }
            BigDecimal delta = left.decimalValue().subtract(right.decimalValue()).abs();
            if (options.getNumericTolerance() > 0) {
                return delta.compareTo(BigDecimal.valueOf(options.getNumericTolerance())) <= 0;
            }
            return delta.signum() == 0;
        }
        if (options.isStrip() && left.isTextual() && right.isTextual()) {
            return left.textValue().strip().equals(right.textValue().strip());
        }
        return left.equals(right);
    }

    private static boolean finite(JsonNode number) {
        return !number.isFloatingPointNumber() || Double.isFinite(number.doubleValue());
    }

    void reportUnsupported(DiffPath path, JsonNode left, JsonNode right) {
        log.warn("Unsupported value shape at '{}': {} vs {}, compared as whole values",
                path, left.getNodeType(), right.getNodeType());
    }
}
