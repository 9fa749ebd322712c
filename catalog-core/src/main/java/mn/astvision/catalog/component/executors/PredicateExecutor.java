package mn.astvision.catalog.component.executors;

import mn.astvision.catalog.exception.FilterException;
import mn.astvision.catalog.predicate.QueryPredicate;
import mn.astvision.catalog.util.CriteriaBuilderUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.support.PageableExecutionUtils;
import org.springframework.util.Assert;

import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Runs a compiled {@link QueryPredicate} against one MongoDB collection with a
 * pagination window, returning the page content together with the total match count.
 *
 * @author zorigtbaatar
 */

public class PredicateExecutor<T> {
    private static final Logger log = LoggerFactory.getLogger(PredicateExecutor.class);

    private final MongoTemplate mongoTemplate;
    private final Class<T> targetType;
    private final String collectionName;
    private final QueryPredicate predicate;
    private final Pageable pageable;

    private PredicateExecutor(Builder<T> builder) {
        this.mongoTemplate = builder.mongoTemplate;
        this.targetType = builder.targetType;
        this.collectionName = builder.collectionName;
        this.predicate = builder.predicate;
        this.pageable = builder.pageable;
    }

    public static <T> Builder<T> forType(Class<T> targetType) {
        return new Builder<>(targetType);
    }

    public Page<T> executePage() {
        Assert.notNull(pageable, () -> "Pageable must not be null, call withPageable(Pageable) before execution");

        Criteria criteria = CriteriaBuilderUtil.buildCriteria(predicate);
        Query queryWithPage = Query.query(criteria).with(pageable);
        if (pageable.getSort().isUnsorted()) {
            queryWithPage.with(Sort.by(Sort.Direction.ASC, "_id"));
        }

        if (log.isDebugEnabled()) {
            log.debug("executing page {} of {}, criteria: {}", pageable, collectionName, criteria.getCriteriaObject().toJson());
        }

        try {
            List<T> content = mongoTemplate.find(queryWithPage, targetType, collectionName);
            LongSupplier countSupplier = () -> mongoTemplate.count(Query.query(criteria), targetType, collectionName);
            return PageableExecutionUtils.getPage(content, pageable, countSupplier);
        } catch (DataAccessException ex) {
            log.error("Failed to execute query on '{}'", collectionName, ex);
            throw ex;
        }
    }

    public static class Builder<T> {
        private final Class<T> targetType;
        private MongoTemplate mongoTemplate;
        private String collectionName;
        private QueryPredicate predicate;
        private Pageable pageable;

        private Builder(Class<T> targetType) {
            this.targetType = Objects.requireNonNull(targetType, "Target type must not be null");
        }

        public Builder<T> withMongoTemplate(MongoTemplate mongoTemplate) {
            this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "MongoTemplate must not be null");
            return this;
        }

        public Builder<T> inCollection(String collectionName) {
            this.collectionName = collectionName;
            return this;
        }

        public Builder<T> withPredicate(QueryPredicate predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder<T> withPageable(Pageable pageable) {
            this.pageable = pageable;
            return this;
        }

        public PredicateExecutor<T> build() {
            if (mongoTemplate == null) {
                throw new FilterException("MongoTemplate must be provided");
            }
            if (predicate == null) {
                throw new FilterException("Predicate must be provided");
            }
            if (collectionName == null || collectionName.isBlank()) {
                this.collectionName = mongoTemplate.getCollectionName(targetType);
            }

            return new PredicateExecutor<>(this);
        }

        public Page<T> executePage() {
            if (pageable == null) this.pageable = Pageable.unpaged();
            return build().executePage();
        }
    }
}
