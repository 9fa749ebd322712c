package mn.astvision.catalog.predicate;

import java.util.List;

/**
 * Matches when every operand matches.
 */
public final class AndPredicate extends CompositePredicate {

    AndPredicate(List<? extends QueryPredicate> operands) {
        super(operands);
    }

    @Override
    protected String symbol() {
        return "&&";
    }

    @Override
    protected String symbolName() {
        return "AND";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AndPredicate && super.equals(o);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + 1;
    }
}
