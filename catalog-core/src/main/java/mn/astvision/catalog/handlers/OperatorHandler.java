package mn.astvision.catalog.handlers;

import org.springframework.data.mongodb.core.query.Criteria;

/**
 * Builds the criteria for one leaf comparison. The value has already been converted to its
 * MongoDB comparable form.
 */
@FunctionalInterface
public interface OperatorHandler {
    Criteria build(String field, Object mongoValue);
}
