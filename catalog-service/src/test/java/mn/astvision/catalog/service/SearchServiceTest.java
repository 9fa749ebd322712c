package mn.astvision.catalog.service;

import mn.astvision.catalog.dto.ProductPageResponse;
import mn.astvision.catalog.exception.FilterException;
import mn.astvision.catalog.exception.ResourceNotFoundException;
import mn.astvision.catalog.model.ConditionGroup;
import mn.astvision.catalog.model.Filter;
import mn.astvision.catalog.model.FilterCondition;
import mn.astvision.catalog.model.enums.FilterLogicMode;
import mn.astvision.catalog.model.enums.FilterOperator;
import mn.astvision.catalog.repository.FilterRepository;
import mn.astvision.catalog.repository.ProductRepository;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchServiceTest {

    @Mock
    private FilterRepository filterRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private MongoTemplate mongoTemplate;

    @InjectMocks
    private SearchService searchService;

    private final Filter waterproofOrPricey = Filter.of("waterproof or pricey", FilterLogicMode.OR,
            ConditionGroup.and(FilterCondition.createGt("price", 100), FilterCondition.createGte("stock", 10)),
            ConditionGroup.and(FilterCondition.createInclude("features", "waterproof"), FilterCondition.of("discount", FilterOperator.LTE, 20)));

    @BeforeEach
    void setUp() {
        lenient().when(productRepository.getCollectionName()).thenReturn("products");
    }

    @Test
    void searchRunsCompiledCriteria() {
        when(filterRepository.findByName("waterproof or pricey")).thenReturn(Optional.of(waterproofOrPricey));
        when(mongoTemplate.find(any(Query.class), eq(Document.class), eq("products"))).thenReturn(List.of(
                new Document("_id", new ObjectId()).append("name", "A").append("price", 150).append("stock", 12),
                new Document("_id", new ObjectId()).append("name", "B").append("price", 10).append("features", List.of("waterproof"))));
        when(mongoTemplate.count(any(Query.class), eq(Document.class), eq("products"))).thenReturn(5L);

        ProductPageResponse response = searchService.search("waterproof or pricey", 1, 2);

        assertThat(response.getProducts()).extracting("name").containsExactly("A", "B");
        assertThat(response.getTotalItems()).isEqualTo(5L);
        assertThat(response.getTotalPages()).isEqualTo(3);
        assertThat(response.getPrevPage()).isNull();
        assertThat(response.getNextPage()).isEqualTo("/api/v1/search/waterproof%20or%20pricey?page=2&per_page=2");

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(Document.class), eq("products"));
        assertThat(query.getValue().getQueryObject()).containsOnlyKeys("$or");
        assertThat(query.getValue().getLimit()).isEqualTo(2);
    }

    @Test
    void unknownFilterIsNotFound() {
        when(filterRepository.findByName("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> searchService.search("missing", 1, 10))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Filter with the name 'missing' was not found.");
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void noMatchesIsNotFound() {
        when(filterRepository.findByName("waterproof or pricey")).thenReturn(Optional.of(waterproofOrPricey));
        when(mongoTemplate.find(any(Query.class), eq(Document.class), eq("products"))).thenReturn(List.of());

        assertThatThrownBy(() -> searchService.search("waterproof or pricey", 1, 10))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("No products found.");
    }

    @Test
    void brokenStoredFilterFailsCompilation() {
        Filter broken = new Filter("broken", FilterLogicMode.AND, List.of(new ConditionGroup(FilterLogicMode.AND, List.of())));
        when(filterRepository.findByName("broken")).thenReturn(Optional.of(broken));

        assertThatThrownBy(() -> searchService.search("broken", 1, 10)).isInstanceOf(FilterException.class);
        verifyNoInteractions(mongoTemplate);
    }
}
