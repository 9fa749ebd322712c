package mn.astvision.catalog.predicate;

import mn.astvision.catalog.model.enums.FilterOperator;

import java.util.List;

/**
 * Compiled, storage independent form of a filter: a leaf comparison or an AND/OR
 * composition of other predicates. Instances are immutable and compare by value.
 *
 * @author zorigtbaatar
 */

public abstract class QueryPredicate {

    QueryPredicate() {
    }

    public static LeafPredicate leaf(String field, FilterOperator operator, Object value) {
        return new LeafPredicate(field, operator, value);
    }

    public static AndPredicate and(List<? extends QueryPredicate> operands) {
        return new AndPredicate(operands);
    }

    public static AndPredicate and(QueryPredicate... operands) {
        return new AndPredicate(List.of(operands));
    }

    public static OrPredicate or(List<? extends QueryPredicate> operands) {
        return new OrPredicate(operands);
    }

    public static OrPredicate or(QueryPredicate... operands) {
        return new OrPredicate(List.of(operands));
    }

    /**
     * @return number of leaf comparisons in this tree
     */
    public abstract int countLeaves();

    /**
     * Renders the tree as a compact boolean expression, e.g.
     * {@code ((price > 100 && stock >= 10) || features include ["waterproof"])}.
     */
    public abstract String toSimpleString();

    @Override
    public String toString() {
        return toSimpleString();
    }
}
