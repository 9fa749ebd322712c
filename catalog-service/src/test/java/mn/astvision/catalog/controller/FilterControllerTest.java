package mn.astvision.catalog.controller;

import mn.astvision.catalog.dto.FilterCreateRequest;
import mn.astvision.catalog.dto.FilterUpdateRequest;
import mn.astvision.catalog.exception.BadRequestException;
import mn.astvision.catalog.exception.ResourceConflictException;
import mn.astvision.catalog.exception.ResourceNotFoundException;
import mn.astvision.catalog.model.ConditionGroup;
import mn.astvision.catalog.model.Filter;
import mn.astvision.catalog.model.FilterCondition;
import mn.astvision.catalog.model.enums.FilterLogicMode;
import mn.astvision.catalog.service.FilterService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FilterController.class)
class FilterControllerTest {

    private static final String F1 = """
            {
              "name": "F1",
              "logical_operator": "OR",
              "conditions": [
                {"logical_operator": "AND", "conditions": [
                  {"field": "price", "operator": ">", "value": 100},
                  {"field": "stock", "operator": ">=", "value": 10}
                ]},
                {"logical_operator": "AND", "conditions": [
                  {"field": "features", "operator": "include", "value": ["waterproof"]},
                  {"field": "discount", "operator": "<=", "value": 20}
                ]}
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FilterService filterService;

    @Test
    void createReturnsCreatedFilter() throws Exception {
        when(filterService.create(any(FilterCreateRequest.class)))
                .thenAnswer(invocation -> {
                    Filter filter = invocation.<FilterCreateRequest>getArgument(0).toFilter();
                    filter.setId("65f0c0ffee0000000000abcd");
                    return filter;
                });

        mockMvc.perform(post("/api/v1/filters").contentType(MediaType.APPLICATION_JSON).content(F1))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("F1"))
                .andExpect(jsonPath("$.logical_operator").value("OR"))
                .andExpect(jsonPath("$.conditions", hasSize(2)))
                .andExpect(jsonPath("$.conditions[1].conditions[0].operator").value("include"));
    }

    @Test
    void createDuplicateIsConflict() throws Exception {
        when(filterService.create(any(FilterCreateRequest.class))).thenThrow(ResourceConflictException.filterName("F1"));

        mockMvc.perform(post("/api/v1/filters").contentType(MediaType.APPLICATION_JSON).content(F1))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.detail").value("Filter with the name F1 already exists."));
    }

    @Test
    void createWithEmptyConditionsIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/v1/filters").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"empty\", \"conditions\": []}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0]", containsString("conditions")));

        verify(filterService, never()).create(any(FilterCreateRequest.class));
    }

    @Test
    void createWithEmptyGroupIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/v1/filters").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"empty\", \"conditions\": [{\"logical_operator\": \"AND\", \"conditions\": []}]}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void createWithUnknownOperatorIsUnprocessable() throws Exception {
        String body = "{\"name\": \"bad\", \"conditions\": [{\"conditions\": [{\"field\": \"name\", \"operator\": \"like\", \"value\": \"x\"}]}]}";

        mockMvc.perform(post("/api/v1/filters").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail", containsString("Unsupported operator 'like'")));
    }

    @Test
    void getMissingFilterIsNotFound() throws Exception {
        when(filterService.get("nope")).thenThrow(ResourceNotFoundException.filter("nope"));

        mockMvc.perform(get("/api/v1/filters/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Filter with name 'nope' not found"));
    }

    @Test
    void listReturnsAllFilters() throws Exception {
        when(filterService.list()).thenReturn(List.of(
                Filter.of("a", FilterLogicMode.AND, ConditionGroup.and(FilterCondition.createEq("color", "red"))),
                Filter.of("b", FilterLogicMode.OR, ConditionGroup.or(FilterCondition.createGt("price", 5)))));

        mockMvc.perform(get("/api/v1/filters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].conditions[0].conditions[0].operator").value(">"));
    }

    @Test
    void patchWithEmptyBodyIsBadRequest() throws Exception {
        when(filterService.update(eq("F1"), any(FilterUpdateRequest.class))).thenThrow(BadRequestException.nothingToUpdate());

        mockMvc.perform(patch("/api/v1/filters/F1").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("No valid fields to update."));
    }

    @Test
    void patchWithBlankNameIsUnprocessable() throws Exception {
        mockMvc.perform(patch("/api/v1/filters/F1").contentType(MediaType.APPLICATION_JSON).content("{\"name\": \"   \"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[0]", containsString("must not be blank")));

        verify(filterService, never()).update(eq("F1"), any(FilterUpdateRequest.class));
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/filters/F1"))
                .andExpect(status().isNoContent());

        verify(filterService).delete("F1");
    }

    @Test
    void deleteMissingIsNotFound() throws Exception {
        doThrow(ResourceNotFoundException.filter("nope")).when(filterService).delete("nope");

        mockMvc.perform(delete("/api/v1/filters/nope"))
                .andExpect(status().isNotFound());
    }
}
