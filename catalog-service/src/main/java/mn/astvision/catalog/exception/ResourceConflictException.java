package mn.astvision.catalog.exception;

public class ResourceConflictException extends RuntimeException {
    public ResourceConflictException(String message) {
        super(message);
    }

    public static ResourceConflictException filterName(String name) {
        return new ResourceConflictException("Filter with the name %s already exists.".formatted(name));
    }

    public static ResourceConflictException productName(String name) {
        return new ResourceConflictException("Product with the name %s already exists.".formatted(name));
    }
}
