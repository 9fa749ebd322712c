package mn.astvision.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import mn.astvision.catalog.model.ConditionGroup;
import mn.astvision.catalog.model.enums.FilterLogicMode;

import java.util.List;

/**
 * Partial filter update. Supplied fields replace the stored ones wholesale; a supplied
 * {@code conditions} list replaces the whole list.
 */
@Getter
@Setter
@NoArgsConstructor
public class FilterUpdateRequest {
    @Size(min = 1, max = 100, message = "Filter name must be between 1 and 100 characters")
    @Pattern(regexp = ".*\\S.*", message = "Filter name must not be blank")
    private String name;

    @JsonProperty("logical_operator")
    private FilterLogicMode logicalOperator;

    @Valid
    @Size(min = 1, message = "Filter must contain at least one condition")
    private List<ConditionGroup> conditions;

    public boolean isEmpty() {
        return name == null && logicalOperator == null && conditions == null;
    }
}
