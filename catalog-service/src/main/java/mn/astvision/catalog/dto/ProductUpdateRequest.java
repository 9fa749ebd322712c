package mn.astvision.catalog.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial product update; only supplied properties are written.
 */
@Getter
@Setter
@NoArgsConstructor
public class ProductUpdateRequest {
    @Size(min = 1, max = 100, message = "Product name must be between 1 and 100 characters")
    @Pattern(regexp = ".*\\S.*", message = "Product name must not be blank")
    private String name;

    @DecimalMin(value = "0", message = "Product price must not be negative")
    @Digits(integer = 8, fraction = 2, message = "Product price must have at most 10 digits and 2 decimals")
    private BigDecimal price;

    private Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonAnySetter
    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public boolean isEmpty() {
        return name == null && price == null && attributes.isEmpty();
    }
}
