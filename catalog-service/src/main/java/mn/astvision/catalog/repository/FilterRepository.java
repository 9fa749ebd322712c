package mn.astvision.catalog.repository;

import mn.astvision.catalog.model.Filter;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface FilterRepository extends MongoRepository<Filter, String> {

    Optional<Filter> findByName(String name);

    boolean existsByName(String name);
}
