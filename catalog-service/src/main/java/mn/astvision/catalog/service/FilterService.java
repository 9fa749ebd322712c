package mn.astvision.catalog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mn.astvision.catalog.dto.FilterCreateRequest;
import mn.astvision.catalog.dto.FilterUpdateRequest;
import mn.astvision.catalog.exception.BadRequestException;
import mn.astvision.catalog.exception.ResourceConflictException;
import mn.astvision.catalog.exception.ResourceNotFoundException;
import mn.astvision.catalog.model.Filter;
import mn.astvision.catalog.repository.FilterRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FilterService {
    private final FilterRepository filterRepository;

    public Filter create(FilterCreateRequest request) {
        if (filterRepository.existsByName(request.getName())) {
            throw ResourceConflictException.filterName(request.getName());
        }

        Filter saved = filterRepository.insert(request.toFilter());
        log.info("Created filter '{}' with {} condition(s)", saved.getName(), saved.countConditions());
        return saved;
    }

    public List<Filter> list() {
        return filterRepository.findAll();
    }

    public Filter get(String name) {
        return filterRepository.findByName(name).orElseThrow(() -> ResourceNotFoundException.filter(name));
    }

    public Filter update(String name, FilterUpdateRequest request) {
        Filter filter = get(name);

        if (request.isEmpty()) {
            throw BadRequestException.nothingToUpdate();
        }

        if (request.getName() != null && !request.getName().equals(filter.getName())) {
            if (filterRepository.existsByName(request.getName())) {
                throw ResourceConflictException.filterName(request.getName());
            }
            filter.setName(request.getName());
        }
        if (request.getLogicalOperator() != null) {
            filter.setLogicalOperator(request.getLogicalOperator());
        }
        if (request.getConditions() != null) {
            filter.setConditions(new ArrayList<>(request.getConditions()));
        }

        Filter saved = filterRepository.save(filter);
        log.info("Updated filter '{}'", saved.getName());
        return saved;
    }

    public void delete(String name) {
        Filter filter = get(name);
        filterRepository.delete(filter);
        log.info("Deleted filter '{}'", name);
    }
}
