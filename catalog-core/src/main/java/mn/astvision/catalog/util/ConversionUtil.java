package mn.astvision.catalog.util;

import org.bson.types.Decimal128;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * @author zorigtbaatar
 */

public class ConversionUtil {

    private ConversionUtil() {
    }

    /**
     * Wraps a scalar into a one element list; collections and arrays are copied element-wise.
     */
    public static List<?> asList(Object value) {
        if (value == null) return List.of();
        if (value instanceof List<?> list) return list;
        if (value instanceof Collection<?> collection) return new ArrayList<>(collection);
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> result = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                result.add(Array.get(value, i));
            }
            return result;
        }
        return List.of(value);
    }

    /**
     * Converts values that MongoDB cannot compare numerically in their Java form.
     * {@link BigDecimal} is stored as {@link Decimal128}; lists are converted element-wise.
     */
    public static Object toMongoComparable(Object value) {
        if (value == null) return null;

        if (value instanceof BigDecimal decimal) {
            return new Decimal128(decimal);
        }
        if (value instanceof BigInteger integer) {
            return new Decimal128(new BigDecimal(integer));
        }
        if (value instanceof Collection<?> collection) {
            List<Object> converted = new ArrayList<>(collection.size());
            for (Object item : collection) {
                converted.add(toMongoComparable(item));
            }
            return converted;
        }

        return value;
    }

    /**
     * Reverse of {@link #toMongoComparable(Object)} for values read back from the store.
     */
    public static Object fromMongoValue(Object value) {
        if (value instanceof Decimal128 decimal) {
            return decimal.bigDecimalValue();
        }
        if (value instanceof Collection<?> collection) {
            List<Object> converted = new ArrayList<>(collection.size());
            for (Object item : collection) {
                converted.add(fromMongoValue(item));
            }
            return converted;
        }
        return value;
    }
}
