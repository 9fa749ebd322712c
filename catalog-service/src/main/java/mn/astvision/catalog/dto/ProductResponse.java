package mn.astvision.catalog.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import mn.astvision.catalog.util.ConversionUtil;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@JsonPropertyOrder({"id", "name", "price"})
public class ProductResponse {
    private final String id;
    private final String name;
    private final BigDecimal price;
    private final Map<String, Object> attributes;

    public ProductResponse(String id, String name, BigDecimal price, Map<String, Object> attributes) {
        this.id = id;
        this.name = name;
        this.price = price;
        this.attributes = attributes;
    }

    public static ProductResponse fromDocument(Document document) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            String key = entry.getKey();
            if (!"_id".equals(key) && !"name".equals(key) && !"price".equals(key)) {
                attributes.put(key, ConversionUtil.fromMongoValue(entry.getValue()));
            }
        }

        Object id = document.get("_id");
        Object price = ConversionUtil.fromMongoValue(document.get("price"));
        return new ProductResponse(
                id instanceof ObjectId objectId ? objectId.toHexString() : String.valueOf(id),
                document.getString("name"),
                toBigDecimal(price),
                attributes);
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value == null) return null;
        if (value instanceof BigDecimal decimal) return decimal;
        return new BigDecimal(value.toString());
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }
}
