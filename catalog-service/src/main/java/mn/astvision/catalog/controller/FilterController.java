package mn.astvision.catalog.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import mn.astvision.catalog.dto.FilterCreateRequest;
import mn.astvision.catalog.dto.FilterUpdateRequest;
import mn.astvision.catalog.model.Filter;
import mn.astvision.catalog.service.FilterService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/filters")
@RequiredArgsConstructor
public class FilterController {
    private final FilterService filterService;

    @PostMapping
    public ResponseEntity<Filter> createFilter(@Valid @RequestBody FilterCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(filterService.create(request));
    }

    @GetMapping
    public ResponseEntity<List<Filter>> listFilters() {
        return ResponseEntity.ok(filterService.list());
    }

    @GetMapping("/{name}")
    public ResponseEntity<Filter> getFilter(@PathVariable String name) {
        return ResponseEntity.ok(filterService.get(name));
    }

    @PatchMapping("/{name}")
    public ResponseEntity<Filter> updateFilter(
            @PathVariable String name,
            @Valid @RequestBody FilterUpdateRequest request
    ) {
        return ResponseEntity.ok(filterService.update(name, request));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteFilter(@PathVariable String name) {
        filterService.delete(name);
        return ResponseEntity.noContent().build();
    }
}
