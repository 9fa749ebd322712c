package mn.astvision.catalog.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import mn.astvision.catalog.model.enums.FilterOperator;

/**
 * A single field/operator/value comparison, the leaf of a filter definition.
 *
 * @author zorigtbaatar
 */

@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
public class FilterCondition {
    @NotBlank(message = "Condition field must not be blank")
    @Size(max = 100, message = "Condition field must be at most 100 characters")
    private String field;
    @NotNull(message = "Condition operator is required")
    private FilterOperator operator;
    @NotNull(message = "Condition value is required")
    private Object value;

    public FilterCondition(String field, FilterOperator operator, Object value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    public static FilterCondition of(String field, FilterOperator operator, Object value) {
        return new FilterCondition(field, operator, value);
    }

    public static FilterCondition createEq(String field, Object value) {
        return new FilterCondition(field, FilterOperator.EQ, value);
    }

    public static FilterCondition createGt(String field, Object value) {
        return new FilterCondition(field, FilterOperator.GT, value);
    }

    public static FilterCondition createGte(String field, Object value) {
        return new FilterCondition(field, FilterOperator.GTE, value);
    }

    public static FilterCondition createInclude(String field, Object value) {
        return new FilterCondition(field, FilterOperator.INCLUDE, value);
    }

    @Override
    public String toString() {
        return "FilterCondition{" + "field='" + field + '\'' + ", operator=" + operator + ", value=" + value + '}';
    }
}
