package quest.gekko.outlier.web.exception;

import java.time.Instant;

/**
 * Body of every error the JSON API returns.
 */
public record ErrorResponse(String code, String message, Instant timestamp, String path) {

    public static ErrorResponse ofValidation(String message, String path) {
        return new ErrorResponse("VALIDATION_ERROR", message, Instant.now(), path);
    }

    public static ErrorResponse ofNotFound(String message, String path) {
        return new ErrorResponse("NOT_FOUND", message, Instant.now(), path);
    }

    public static ErrorResponse ofConflict(String message, String path) {
        return new ErrorResponse("CONFLICT", message, Instant.now(), path);
    }

    public static ErrorResponse ofForbidden(String path) {
        return new ErrorResponse("FORBIDDEN", "Access denied", Instant.now(), path);
    }

    public static ErrorResponse ofInternal(String path) {
        return new ErrorResponse("INTERNAL_SERVER_ERROR", "An unexpected error occurred", Instant.now(), path);
    }
}
