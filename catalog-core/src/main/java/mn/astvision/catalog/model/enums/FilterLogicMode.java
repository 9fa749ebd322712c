package mn.astvision.catalog.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum FilterLogicMode {
    AND,
    OR;

    @JsonCreator
    public static FilterLogicMode fromString(String value) {
        if (value == null) throw new IllegalArgumentException("FilterLogicMode cannot be null");

        for (FilterLogicMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown logical operator: " + value + ". Allowed: AND, OR");
    }
}
