package mn.astvision.catalog.exception;

public class BadRequestException extends RuntimeException {
    public BadRequestException(String message) {
        super(message);
    }

    public static BadRequestException nothingToUpdate() {
        return new BadRequestException("No valid fields to update.");
    }
}
