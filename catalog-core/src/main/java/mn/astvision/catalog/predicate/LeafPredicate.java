package mn.astvision.catalog.predicate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import mn.astvision.catalog.exception.FilterException;
import mn.astvision.catalog.model.enums.FilterOperator;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * @author zorigtbaatar
 */

@Getter
@EqualsAndHashCode(callSuper = false)
public final class LeafPredicate extends QueryPredicate {
    private final String field;
    private final FilterOperator operator;
    private final Object value;

    LeafPredicate(String field, FilterOperator operator, Object value) {
        if (field == null || field.isBlank()) throw new FilterException("Leaf predicate requires a field");
        if (operator == null) throw new FilterException("Unsupported operator: null for field '%s'".formatted(field));

        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    @Override
    public int countLeaves() {
        return 1;
    }

    @Override
    public String toSimpleString() {
        return field + " " + operator.getLogicExpression() + " " + formatValue(value);
    }

    private static String formatValue(Object value) {
        if (value instanceof Collection<?> list) {
            return list.stream().map(LeafPredicate::formatValue).collect(Collectors.joining(", ", "[", "]"));
        }

        if (value instanceof String str) {
            return "\"" + str + "\"";
        }

        return String.valueOf(value);
    }
}
