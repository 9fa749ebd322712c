package mn.astvision.catalog.handlers;

import mn.astvision.catalog.exception.FilterException;
import mn.astvision.catalog.model.enums.FilterOperator;
import mn.astvision.catalog.util.PatternCacheUtil;
import org.springframework.data.mongodb.core.query.Criteria;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static mn.astvision.catalog.util.ConversionUtil.asList;


/**
 * @author zorigtbaatar
 */

public class DefaultOperatorHandlers {

    private DefaultOperatorHandlers() {
    }

    static void registerAll() {
        for (FilterOperator operator : FilterOperator.values()) {
            OperatorHandlerRegistry.register(operator, handlerFor(operator));
        }
    }

    static OperatorHandler handlerFor(FilterOperator operator) {
        return switch (operator) {
            case EQ -> (f, v) -> Criteria.where(f).is(v);
            case NEQ -> (f, v) -> Criteria.where(f).ne(v);
            case GT -> (f, v) -> Criteria.where(f).gt(v);
            case GTE -> (f, v) -> Criteria.where(f).gte(v);
            case LT -> (f, v) -> Criteria.where(f).lt(v);
            case LTE -> (f, v) -> Criteria.where(f).lte(v);
            // $in matches scalar fields equal to an element and array fields containing one
            case INCLUDE -> (f, v) -> Criteria.where(f).in(asList(v));
            case REGEX -> DefaultOperatorHandlers::regex;
        };
    }

    private static Criteria regex(String field, Object value) {
        try {
            Pattern pattern = PatternCacheUtil.get(value.toString(), Pattern.CASE_INSENSITIVE);
            return Criteria.where(field).regex(pattern);
        } catch (PatternSyntaxException ex) {
            throw new FilterException("Invalid regex pattern for field '%s': %s".formatted(field, value), ex);
        }
    }
}
