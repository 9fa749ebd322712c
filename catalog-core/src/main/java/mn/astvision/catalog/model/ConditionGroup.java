package mn.astvision.catalog.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import mn.astvision.catalog.model.enums.FilterLogicMode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Conditions combined with one logical operator. The middle level of a filter definition.
 *
 * @author zorigtbaatar
 */

@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
public class ConditionGroup {
    @JsonProperty("logical_operator")
    private FilterLogicMode logicalOperator = FilterLogicMode.AND;
    @Valid
    @NotEmpty(message = "Condition group must contain at least one condition")
    private List<FilterCondition> conditions = new ArrayList<>();

    public ConditionGroup(FilterLogicMode logicalOperator, List<FilterCondition> conditions) {
        setLogicalOperator(logicalOperator);
        this.conditions = new ArrayList<>(conditions);
    }

    public static ConditionGroup and(FilterCondition... conditions) {
        return new ConditionGroup(FilterLogicMode.AND, Arrays.asList(conditions));
    }

    public static ConditionGroup or(FilterCondition... conditions) {
        return new ConditionGroup(FilterLogicMode.OR, Arrays.asList(conditions));
    }

    public void setLogicalOperator(FilterLogicMode logicalOperator) {
        this.logicalOperator = logicalOperator != null ? logicalOperator : FilterLogicMode.AND;
    }
}
