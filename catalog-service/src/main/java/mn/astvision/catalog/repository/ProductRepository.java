package mn.astvision.catalog.repository;

import mn.astvision.catalog.config.CatalogProperties;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.data.support.PageableExecutionUtils;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Product documents are schemaless, so they are read and written as raw BSON documents.
 */
@Repository
public class ProductRepository {
    private final MongoTemplate mongoTemplate;
    private final String collection;

    public ProductRepository(MongoTemplate mongoTemplate, CatalogProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.collection = properties.getProductsCollection();
    }

    public String getCollectionName() {
        return collection;
    }

    public Page<Document> findAll(Pageable pageable) {
        Query query = new Query().with(pageable).with(Sort.by(Sort.Direction.ASC, "_id"));
        List<Document> content = mongoTemplate.find(query, Document.class, collection);
        return PageableExecutionUtils.getPage(content, pageable, this::count);
    }

    public long count() {
        return mongoTemplate.count(new Query(), collection);
    }

    public Optional<Document> findById(ObjectId id) {
        return Optional.ofNullable(mongoTemplate.findById(id, Document.class, collection));
    }

    public boolean existsByName(String name) {
        return mongoTemplate.exists(Query.query(Criteria.where("name").is(name)), collection);
    }

    public boolean existsByNameAndIdNot(String name, ObjectId id) {
        return mongoTemplate.exists(Query.query(Criteria.where("name").is(name).and("_id").ne(id)), collection);
    }

    public Document insert(Document document) {
        return mongoTemplate.insert(document, collection);
    }

    public Optional<Document> update(ObjectId id, Map<String, Object> changes) {
        Update update = new Update();
        changes.forEach(update::set);
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(id)), update, collection);
        return findById(id);
    }

    public boolean delete(ObjectId id) {
        return mongoTemplate.remove(Query.query(Criteria.where("_id").is(id)), collection).getDeletedCount() > 0;
    }
}
