package mn.astvision.catalog.exception;

public class ResourceNotFoundException extends RuntimeException {
    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException filter(String name) {
        return new ResourceNotFoundException("Filter with name '%s' not found".formatted(name));
    }

    public static ResourceNotFoundException product() {
        return new ResourceNotFoundException("Product with the given ID was not found.");
    }

    public static ResourceNotFoundException noProducts() {
        return new ResourceNotFoundException("No products found.");
    }
}
