package mn.astvision.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import org.springframework.data.domain.Page;

import java.util.List;

/**
 * One page of products with links to the neighbouring pages.
 */
@Getter
public class ProductPageResponse {
    private final List<ProductResponse> products;
    @JsonProperty("prev_page")
    private final String prevPage;
    @JsonProperty("next_page")
    private final String nextPage;
    @JsonProperty("total_pages")
    private final int totalPages;
    @JsonProperty("total_items")
    private final long totalItems;

    public ProductPageResponse(List<ProductResponse> products, String prevPage, String nextPage, int totalPages, long totalItems) {
        this.products = products;
        this.prevPage = prevPage;
        this.nextPage = nextPage;
        this.totalPages = totalPages;
        this.totalItems = totalItems;
    }

    /**
     * @param basePath path the page links point at, without query string
     * @param page     one-based page number
     */
    public static ProductPageResponse of(Page<ProductResponse> result, String basePath, int page, int perPage) {
        long totalItems = result.getTotalElements();
        int totalPages = (int) ((totalItems + perPage - 1) / perPage);

        String prev = page > 1 ? link(basePath, page - 1, perPage) : null;
        String next = page < totalPages ? link(basePath, page + 1, perPage) : null;

        return new ProductPageResponse(result.getContent(), prev, next, totalPages, totalItems);
    }

    private static String link(String basePath, int page, int perPage) {
        return "%s?page=%d&per_page=%d".formatted(basePath, page, perPage);
    }
}
