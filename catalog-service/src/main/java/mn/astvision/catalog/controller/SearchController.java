package mn.astvision.catalog.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import mn.astvision.catalog.dto.ProductPageResponse;
import mn.astvision.catalog.service.SearchService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(SearchService.BASE_PATH)
@RequiredArgsConstructor
public class SearchController {
    private final SearchService searchService;

    @GetMapping("/{filterName}")
    public ResponseEntity<ProductPageResponse> searchProducts(
            @PathVariable String filterName,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(name = "per_page", defaultValue = "10") @Min(1) @Max(20) int perPage
    ) {
        return ResponseEntity.ok(searchService.search(filterName, page, perPage));
    }
}
