package app.mediafill.autofill.resolve;

public class MediaResolveException extends RuntimeException {

    public MediaResolveException(String message) {
        super(message);
    }

    public MediaResolveException(String message, Throwable cause) {
        super(message, cause);
    }
}
