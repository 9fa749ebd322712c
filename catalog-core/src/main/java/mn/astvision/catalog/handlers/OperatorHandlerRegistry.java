package mn.astvision.catalog.handlers;

import mn.astvision.catalog.exception.FilterException;
import mn.astvision.catalog.model.enums.FilterOperator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps every {@link FilterOperator} to the handler that builds its MongoDB criteria.
 *
 * @author zorigtbaatar
 */

public class OperatorHandlerRegistry {
    private static final Map<FilterOperator, OperatorHandler> HANDLERS = new EnumMap<>(FilterOperator.class);

    static {
        DefaultOperatorHandlers.registerAll();
    }

    private OperatorHandlerRegistry() {
    }

    static synchronized void register(FilterOperator operator, OperatorHandler handler) {
        if (HANDLERS.containsKey(operator)) {
            throw new IllegalStateException("Handler already registered for: %s".formatted(operator));
        }

        HANDLERS.put(operator, handler);
    }

    public static OperatorHandler get(FilterOperator operator) {
        OperatorHandler handler = operator == null ? null : HANDLERS.get(operator);
        if (handler == null) {
            throw new FilterException("Unsupported operator: %s".formatted(operator),
                    "Allowed operators: " + FilterOperator.allowedOperators());
        }
        return handler;
    }

    public static boolean contains(FilterOperator operator) {
        return HANDLERS.containsKey(operator);
    }

    public static Set<FilterOperator> getRegisteredOperators() {
        return Collections.unmodifiableSet(HANDLERS.keySet());
    }
}
