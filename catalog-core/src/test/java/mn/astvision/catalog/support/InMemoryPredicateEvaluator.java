package mn.astvision.catalog.support;

import mn.astvision.catalog.predicate.AndPredicate;
import mn.astvision.catalog.predicate.LeafPredicate;
import mn.astvision.catalog.predicate.OrPredicate;
import mn.astvision.catalog.predicate.QueryPredicate;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Evaluates a predicate tree against plain map documents using MongoDB matching rules:
 * array fields match when any element matches, missing fields never satisfy ordered
 * comparisons, and $ne matches missing fields.
 */
public final class InMemoryPredicateEvaluator {

    private InMemoryPredicateEvaluator() {
    }

    public static List<Map<String, Object>> select(QueryPredicate predicate, List<Map<String, Object>> documents) {
        return documents.stream().filter(doc -> matches(predicate, doc)).toList();
    }

    public static boolean matches(QueryPredicate predicate, Map<String, Object> document) {
        if (predicate instanceof AndPredicate and) {
            return and.getOperands().stream().allMatch(p -> matches(p, document));
        }
        if (predicate instanceof OrPredicate or) {
            return or.getOperands().stream().anyMatch(p -> matches(p, document));
        }
        if (predicate instanceof LeafPredicate leaf) {
            return matchesLeaf(leaf, document);
        }
        throw new IllegalArgumentException("Unknown predicate " + predicate);
    }

    private static boolean matchesLeaf(LeafPredicate leaf, Map<String, Object> document) {
        boolean present = document.containsKey(leaf.getField());
        Object stored = document.get(leaf.getField());
        Object value = leaf.getValue();

        return switch (leaf.getOperator()) {
            case EQ -> present && equalsOrContains(stored, value);
            case NEQ -> !present || !equalsOrContains(stored, value);
            case GT -> present && anyElement(stored, s -> compare(s, value, c -> c > 0));
            case GTE -> present && anyElement(stored, s -> compare(s, value, c -> c >= 0));
            case LT -> present && anyElement(stored, s -> compare(s, value, c -> c < 0));
            case LTE -> present && anyElement(stored, s -> compare(s, value, c -> c <= 0));
            case INCLUDE -> present && ((Collection<?>) value).stream().anyMatch(v -> equalsOrContains(stored, v));
            case REGEX -> present && anyElement(stored, s -> s instanceof String str
                    && Pattern.compile(value.toString(), Pattern.CASE_INSENSITIVE).matcher(str).find());
        };
    }

    private static boolean equalsOrContains(Object stored, Object value) {
        if (valueEquals(stored, value)) return true;
        return stored instanceof Collection<?> list && list.stream().anyMatch(item -> valueEquals(item, value));
    }

    private static boolean anyElement(Object stored, Predicate<Object> test) {
        if (stored instanceof Collection<?> list) {
            return list.stream().anyMatch(test);
        }
        return test.test(stored);
    }

    private static boolean valueEquals(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return toDecimal(x).compareTo(toDecimal(y)) == 0;
        }
        return Objects.equals(a, b);
    }

    // values of different types never satisfy an ordered comparison
    private static boolean compare(Object stored, Object value, IntPredicate test) {
        if (stored instanceof Number x && value instanceof Number y) {
            return test.test(toDecimal(x).compareTo(toDecimal(y)));
        }
        if (stored instanceof String x && value instanceof String y) {
            return test.test(x.compareTo(y));
        }
        return false;
    }

    private static BigDecimal toDecimal(Number number) {
        return number instanceof BigDecimal decimal ? decimal : new BigDecimal(number.toString());
    }
}
