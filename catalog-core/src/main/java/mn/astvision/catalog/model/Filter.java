package mn.astvision.catalog.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.FieldNameConstants;
import mn.astvision.catalog.model.enums.FilterLogicMode;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A named, persisted boolean query over product fields.
 * The name is the identity key used for lookup and deletion.
 *
 * @author zorigtbaatar
 */

@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@FieldNameConstants
@Document(collection = "filters")
public class Filter {
    @Id
    private String id;
    @Indexed(unique = true)
    @NotBlank(message = "Filter name must not be blank")
    @Size(max = 100, message = "Filter name must be at most 100 characters")
    private String name;
    @JsonProperty("logical_operator")
    private FilterLogicMode logicalOperator = FilterLogicMode.AND;
    @Valid
    @NotEmpty(message = "Filter must contain at least one condition group")
    private List<ConditionGroup> conditions = new ArrayList<>();

    public Filter(String name, FilterLogicMode logicalOperator, List<ConditionGroup> conditions) {
        this.name = name;
        setLogicalOperator(logicalOperator);
        this.conditions = new ArrayList<>(conditions);
    }

    public static Filter of(String name, FilterLogicMode logicalOperator, ConditionGroup... groups) {
        return new Filter(name, logicalOperator, Arrays.asList(groups));
    }

    public void setLogicalOperator(FilterLogicMode logicalOperator) {
        this.logicalOperator = logicalOperator != null ? logicalOperator : FilterLogicMode.AND;
    }

    public int countConditions() {
        if (conditions == null) return 0;
        return conditions.stream().mapToInt(group -> group.getConditions() == null ? 0 : group.getConditions().size()).sum();
    }
}
