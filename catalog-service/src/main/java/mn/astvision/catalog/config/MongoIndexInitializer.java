package mn.astvision.catalog.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mn.astvision.catalog.model.Filter;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.stereotype.Component;

/**
 * Products are stored as raw documents, so their unique name index is not derived from a
 * mapped entity and has to be created here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoIndexInitializer {
    private final MongoTemplate mongoTemplate;
    private final CatalogProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        String products = properties.getProductsCollection();
        mongoTemplate.indexOps(products).ensureIndex(new Index().on("name", Sort.Direction.ASC).unique());
        mongoTemplate.indexOps(Filter.class).ensureIndex(new Index().on(Filter.Fields.name, Sort.Direction.ASC).unique());
        log.info("Ensured unique name indexes on '{}' and '{}'", products, mongoTemplate.getCollectionName(Filter.class));
    }
}
