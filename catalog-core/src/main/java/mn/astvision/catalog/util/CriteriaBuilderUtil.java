package mn.astvision.catalog.util;

import mn.astvision.catalog.exception.FilterException;
import mn.astvision.catalog.handlers.OperatorHandlerRegistry;
import mn.astvision.catalog.predicate.AndPredicate;
import mn.astvision.catalog.predicate.CompositePredicate;
import mn.astvision.catalog.predicate.LeafPredicate;
import mn.astvision.catalog.predicate.OrPredicate;
import mn.astvision.catalog.predicate.QueryPredicate;
import org.springframework.data.mongodb.core.query.Criteria;

import java.util.List;


/**
 * Storage adapter from {@link QueryPredicate} to MongoDB {@link Criteria}.
 *
 * @author zorigtbaatar
 */

public class CriteriaBuilderUtil {

    private CriteriaBuilderUtil() {
    }

    public static Criteria buildCriteria(QueryPredicate predicate) {
        if (predicate == null) throw new FilterException("Predicate must not be null");

        if (predicate instanceof LeafPredicate leaf) {
            return buildSingleCriteria(leaf);
        }
        if (predicate instanceof AndPredicate and) {
            return new Criteria().andOperator(buildOperands(and));
        }
        if (predicate instanceof OrPredicate or) {
            return new Criteria().orOperator(buildOperands(or));
        }

        throw new FilterException("Unknown predicate type: %s".formatted(predicate.getClass().getSimpleName()));
    }

    private static Criteria[] buildOperands(CompositePredicate composite) {
        List<QueryPredicate> operands = composite.getOperands();
        Criteria[] criteria = new Criteria[operands.size()];
        for (int i = 0; i < operands.size(); i++) {
            criteria[i] = buildCriteria(operands.get(i));
        }
        return criteria;
    }

    static Criteria buildSingleCriteria(LeafPredicate leaf) {
        Object value = ConversionUtil.toMongoComparable(leaf.getValue());
        return OperatorHandlerRegistry.get(leaf.getOperator()).build(leaf.getField(), value);
    }
}
