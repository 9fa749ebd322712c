package mn.astvision.catalog.predicate;

import java.util.List;

/**
 * Matches when at least one operand matches.
 */
public final class OrPredicate extends CompositePredicate {

    OrPredicate(List<? extends QueryPredicate> operands) {
        super(operands);
    }

    @Override
    protected String symbol() {
        return "||";
    }

    @Override
    protected String symbolName() {
        return "OR";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OrPredicate && super.equals(o);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + 2;
    }
}
