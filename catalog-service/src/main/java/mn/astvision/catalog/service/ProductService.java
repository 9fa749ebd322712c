package mn.astvision.catalog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mn.astvision.catalog.dto.ProductCreateRequest;
import mn.astvision.catalog.dto.ProductPageResponse;
import mn.astvision.catalog.dto.ProductResponse;
import mn.astvision.catalog.dto.ProductUpdateRequest;
import mn.astvision.catalog.exception.BadRequestException;
import mn.astvision.catalog.exception.ResourceConflictException;
import mn.astvision.catalog.exception.ResourceNotFoundException;
import mn.astvision.catalog.repository.ProductRepository;
import mn.astvision.catalog.util.ConversionUtil;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductService {
    public static final String BASE_PATH = "/api/v1/products";

    private static final Set<String> RESERVED_ATTRIBUTES = Set.of("_id", "id");

    private final ProductRepository productRepository;

    public ProductPageResponse list(int page, int perPage) {
        long total = productRepository.count();
        if (total == 0) {
            throw ResourceNotFoundException.noProducts();
        }

        Page<ProductResponse> result = productRepository.findAll(PageRequest.of(page - 1, perPage))
                .map(ProductResponse::fromDocument);
        if (result.getContent().isEmpty()) {
            throw ResourceNotFoundException.noProducts();
        }

        return ProductPageResponse.of(result, BASE_PATH, page, perPage);
    }

    public ProductResponse get(String id) {
        return ProductResponse.fromDocument(findOrThrow(id));
    }

    public ProductResponse create(ProductCreateRequest request) {
        if (productRepository.existsByName(request.getName())) {
            throw ResourceConflictException.productName(request.getName());
        }

        Document document = new Document();
        document.put("name", request.getName());
        document.put("price", ConversionUtil.toMongoComparable(request.getPrice()));
        request.getAttributes().forEach((key, value) -> {
            if (!RESERVED_ATTRIBUTES.contains(key)) {
                document.put(key, value);
            }
        });

        Document saved = productRepository.insert(document);
        log.info("Created product '{}' ({})", request.getName(), saved.get("_id"));
        return ProductResponse.fromDocument(saved);
    }

    public ProductResponse update(String id, ProductUpdateRequest request) {
        ObjectId objectId = parseId(id);
        findOrThrow(id);

        if (request.isEmpty()) {
            throw BadRequestException.nothingToUpdate();
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        request.getAttributes().forEach((key, value) -> {
            if (!RESERVED_ATTRIBUTES.contains(key)) {
                changes.put(key, value);
            }
        });
        if (request.getName() != null) {
            if (productRepository.existsByNameAndIdNot(request.getName(), objectId)) {
                throw ResourceConflictException.productName(request.getName());
            }
            changes.put("name", request.getName());
        }
        if (request.getPrice() != null) {
            changes.put("price", ConversionUtil.toMongoComparable(request.getPrice()));
        }
        if (changes.isEmpty()) {
            throw BadRequestException.nothingToUpdate();
        }

        Document updated = productRepository.update(objectId, changes)
                .orElseThrow(ResourceNotFoundException::product);
        log.info("Updated product {} fields {}", id, changes.keySet());
        return ProductResponse.fromDocument(updated);
    }

    public void delete(String id) {
        if (!productRepository.delete(parseId(id))) {
            throw ResourceNotFoundException.product();
        }
        log.info("Deleted product {}", id);
    }

    private Document findOrThrow(String id) {
        return productRepository.findById(parseId(id)).orElseThrow(ResourceNotFoundException::product);
    }

    private static ObjectId parseId(String id) {
        if (!ObjectId.isValid(id)) {
            throw ResourceNotFoundException.product();
        }
        return new ObjectId(id);
    }
}
