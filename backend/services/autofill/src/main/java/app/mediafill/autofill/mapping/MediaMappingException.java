package app.mediafill.autofill.mapping;

public class MediaMappingException extends RuntimeException {

    public MediaMappingException(String message) {
        super(message);
    }

    public MediaMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
