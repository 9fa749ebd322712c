package mn.astvision.catalog.predicate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import mn.astvision.catalog.exception.FilterException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Base for AND/OR nodes. An empty operand list is refused: a vacuous AND would match
 * every document and a vacuous OR none.
 *
 * @author zorigtbaatar
 */

@Getter
@EqualsAndHashCode(callSuper = false)
public abstract class CompositePredicate extends QueryPredicate {
    private final List<QueryPredicate> operands;

    CompositePredicate(List<? extends QueryPredicate> operands) {
        if (operands == null || operands.isEmpty()) {
            throw new FilterException("%s requires at least one operand".formatted(symbolName()));
        }
        if (operands.stream().anyMatch(Objects::isNull)) {
            throw new FilterException("%s operands must not be null".formatted(symbolName()));
        }
        this.operands = List.copyOf(operands);
    }

    protected abstract String symbol();

    protected abstract String symbolName();

    @Override
    public int countLeaves() {
        return operands.stream().mapToInt(QueryPredicate::countLeaves).sum();
    }

    @Override
    public String toSimpleString() {
        return operands.stream()
                .map(QueryPredicate::toSimpleString)
                .collect(Collectors.joining(" " + symbol() + " ", "(", ")"));
    }
}
