package mn.astvision.catalog.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Closed set of comparison operators a filter condition may use.
 * Each operator has a symbolic representation, which is also its JSON form.
 */
@Getter
public enum FilterOperator {
    /**
     * Equals operator (==).
     * MongoDB: "$eq"
     */
    EQ("=="),

    /**
     * Not equals operator (!=).
     * MongoDB: "$ne"
     */
    NEQ("!="),

    /**
     * Greater than operator (>).
     * MongoDB: "$gt"
     */
    GT(">"),

    /**
     * Greater than or equal operator (>=).
     * MongoDB: "$gte"
     */
    GTE(">="),

    /**
     * Less than operator (<).
     * MongoDB: "$lt"
     */
    LT("<"),

    /**
     * Less than or equal operator (<=).
     * MongoDB: "$lte"
     */
    LTE("<="),

    /**
     * Membership test ("include").
     * A scalar value is treated as a one element list; the stored field, scalar or array,
     * must equal or contain any element of that list.
     * MongoDB: "$in"
     */
    INCLUDE("include"),

    /**
     * Case-insensitive regular expression match ("regex").
     * MongoDB: "$regex" with option "i"
     */
    REGEX("regex");

    private final String logicExpression;

    FilterOperator(String logicExpression) {
        this.logicExpression = logicExpression;
    }

    /**
     * Resolves an operator from its symbol or its constant name, ignoring case.
     *
     * @param value the string representation of the operator (e.g. "==", "include", "GTE")
     * @return corresponding FilterOperator enum
     * @throws IllegalArgumentException if no matching operator is found
     */
    @JsonCreator
    public static FilterOperator fromString(String value) {
        if (value == null) throw new IllegalArgumentException("FilterOperator cannot be null");

        String v = value.trim();
        for (FilterOperator op : values()) {
            if (op.logicExpression.equalsIgnoreCase(v) || op.name().equalsIgnoreCase(v)) {
                return op;
            }
        }

        throw new IllegalArgumentException("Unsupported operator '%s'. Allowed operators: %s".formatted(value, allowedOperators()));
    }

    public static String allowedOperators() {
        return Arrays.stream(values()).map(FilterOperator::getLogicExpression).collect(Collectors.joining(", "));
    }

    @JsonValue
    public String getLogicExpression() {
        return logicExpression;
    }
}
