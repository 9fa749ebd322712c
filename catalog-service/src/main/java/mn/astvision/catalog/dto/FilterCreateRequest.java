package mn.astvision.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import mn.astvision.catalog.model.ConditionGroup;
import mn.astvision.catalog.model.Filter;
import mn.astvision.catalog.model.enums.FilterLogicMode;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class FilterCreateRequest {
    @NotBlank(message = "Filter name must not be blank")
    @Size(max = 100, message = "Filter name must be at most 100 characters")
    private String name;

    @JsonProperty("logical_operator")
    private FilterLogicMode logicalOperator = FilterLogicMode.AND;

    @Valid
    @NotEmpty(message = "Filter must contain at least one condition")
    private List<ConditionGroup> conditions = new ArrayList<>();

    public FilterCreateRequest(String name, FilterLogicMode logicalOperator, List<ConditionGroup> conditions) {
        this.name = name;
        setLogicalOperator(logicalOperator);
        this.conditions = conditions;
    }

    public void setLogicalOperator(FilterLogicMode logicalOperator) {
        this.logicalOperator = logicalOperator != null ? logicalOperator : FilterLogicMode.AND;
    }

    public Filter toFilter() {
        return new Filter(name, logicalOperator, conditions);
    }
}
