package mn.astvision.catalog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {
    /**
     * MongoDB collection holding product documents.
     */
    private String productsCollection = "products";
}
