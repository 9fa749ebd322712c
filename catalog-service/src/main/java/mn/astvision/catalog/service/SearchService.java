package mn.astvision.catalog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mn.astvision.catalog.compiler.FilterCompiler;
import mn.astvision.catalog.component.executors.PredicateExecutor;
import mn.astvision.catalog.dto.ProductPageResponse;
import mn.astvision.catalog.dto.ProductResponse;
import mn.astvision.catalog.exception.ResourceNotFoundException;
import mn.astvision.catalog.model.Filter;
import mn.astvision.catalog.predicate.QueryPredicate;
import mn.astvision.catalog.repository.FilterRepository;
import mn.astvision.catalog.repository.ProductRepository;
import org.bson.Document;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Evaluates a stored filter against the product collection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {
    public static final String BASE_PATH = "/api/v1/search";

    private final FilterRepository filterRepository;
    private final ProductRepository productRepository;
    private final MongoTemplate mongoTemplate;

    public ProductPageResponse search(String filterName, int page, int perPage) {
        Filter filter = filterRepository.findByName(filterName)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Filter with the name '%s' was not found.".formatted(filterName)));

        QueryPredicate predicate = FilterCompiler.compile(filter);
        if (log.isDebugEnabled()) {
            log.debug("Filter '{}' compiled to {}", filterName, predicate.toSimpleString());
        }

        Page<ProductResponse> result = PredicateExecutor.forType(Document.class)
                .withMongoTemplate(mongoTemplate)
                .inCollection(productRepository.getCollectionName())
                .withPredicate(predicate)
                .withPageable(PageRequest.of(page - 1, perPage))
                .executePage()
                .map(ProductResponse::fromDocument);

        if (result.getTotalElements() == 0 || result.getContent().isEmpty()) {
            throw ResourceNotFoundException.noProducts();
        }

        String basePath = BASE_PATH + "/" + UriUtils.encodePathSegment(filterName, StandardCharsets.UTF_8);
        return ProductPageResponse.of(result, basePath, page, perPage);
    }
}
