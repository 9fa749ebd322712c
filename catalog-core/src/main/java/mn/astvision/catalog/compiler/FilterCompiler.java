package mn.astvision.catalog.compiler;

import mn.astvision.catalog.exception.FilterException;
import mn.astvision.catalog.model.ConditionGroup;
import mn.astvision.catalog.model.Filter;
import mn.astvision.catalog.model.FilterCondition;
import mn.astvision.catalog.model.enums.FilterLogicMode;
import mn.astvision.catalog.model.enums.FilterOperator;
import mn.astvision.catalog.predicate.LeafPredicate;
import mn.astvision.catalog.predicate.QueryPredicate;
import mn.astvision.catalog.util.ConversionUtil;
import mn.astvision.catalog.util.PatternCacheUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Translates a {@link Filter} into a {@link QueryPredicate}.
 * <p>
 * Filters nest exactly two levels (filter, group, condition), so compilation is two
 * fixed steps: every group becomes one AND/OR of its leaves, then the group predicates
 * are combined with the filter's own logical operator. Order is preserved at both levels.
 * <p>
 * Stateless; safe to share between threads.
 *
 * @author zorigtbaatar
 */

public final class FilterCompiler {

    private FilterCompiler() {
    }

    public static QueryPredicate compile(Filter filter) {
        if (filter == null) throw new FilterException("Filter must not be null");

        List<ConditionGroup> groups = filter.getConditions();
        if (groups == null || groups.isEmpty()) {
            throw new FilterException("Filter '%s' has no condition groups".formatted(filter.getName()),
                    "A filter must contain at least one condition group");
        }

        List<QueryPredicate> groupPredicates = new ArrayList<>(groups.size());
        for (ConditionGroup group : groups) {
            groupPredicates.add(compile(group));
        }

        return combine(filter.getLogicalOperator(), groupPredicates);
    }

    public static QueryPredicate compile(ConditionGroup group) {
        if (group == null) throw new FilterException("Condition group must not be null");

        List<FilterCondition> conditions = group.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            throw new FilterException("Condition group has no conditions",
                    "Every condition group must contain at least one condition");
        }

        List<QueryPredicate> leaves = new ArrayList<>(conditions.size());
        for (FilterCondition condition : conditions) {
            leaves.add(compileCondition(condition));
        }

        return combine(group.getLogicalOperator(), leaves);
    }

    public static LeafPredicate compileCondition(FilterCondition condition) {
        if (condition == null) throw new FilterException("Condition must not be null");
        return compileCondition(condition.getField(), condition.getOperator(), condition.getValue());
    }

    public static LeafPredicate compileCondition(String field, FilterOperator operator, Object value) {
        if (field == null || field.isBlank()) throw new FilterException("Condition field is required");
        if (operator == null) {
            throw new FilterException("Unsupported operator: null for field '%s'".formatted(field),
                    "Allowed operators: " + FilterOperator.allowedOperators());
        }
        if (value == null) throw new FilterException("Condition value is required for field '%s'".formatted(field));

        Object normalized = switch (operator) {
            case EQ, NEQ, GT, GTE, LT, LTE -> value;
            // $in accepts null elements, so the list is copied without List.copyOf
            case INCLUDE -> Collections.unmodifiableList(new ArrayList<>(ConversionUtil.asList(value)));
            case REGEX -> validateRegex(field, value);
        };

        return QueryPredicate.leaf(field, operator, normalized);
    }

    private static QueryPredicate combine(FilterLogicMode mode, List<QueryPredicate> operands) {
        FilterLogicMode logic = mode != null ? mode : FilterLogicMode.AND;
        return switch (logic) {
            case AND -> QueryPredicate.and(operands);
            case OR -> QueryPredicate.or(operands);
        };
    }

    private static String validateRegex(String field, Object value) {
        if (!(value instanceof String pattern)) {
            throw new FilterException("REGEX operator on field '%s' requires a string pattern, got %s"
                    .formatted(field, value.getClass().getSimpleName()));
        }

        try {
            PatternCacheUtil.get(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException ex) {
            throw new FilterException("Invalid regex pattern for field '%s': %s".formatted(field, pattern), ex);
        }
        return pattern;
    }
}
