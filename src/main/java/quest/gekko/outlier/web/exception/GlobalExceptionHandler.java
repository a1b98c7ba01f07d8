package quest.gekko.outlier.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.outlier.service.core.ChannelNotFoundException;
import quest.gekko.outlier.service.core.VideoNotFoundException;
import quest.gekko.outlier.service.maintenance.UnknownMaintenanceOperationException;
import quest.gekko.outlier.service.refresh.RefreshAlreadyRunningException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity.badRequest().body(ErrorResponse.ofValidation(ex.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleNotValid(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {} for URL: {}", message, request.getRequestURI());
        return ResponseEntity.badRequest().body(ErrorResponse.ofValidation(message, request.getRequestURI()));
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex, HttpServletRequest request) {
        log.warn("Bad parameter: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity.badRequest().body(ErrorResponse.ofValidation(ex.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler({
            VideoNotFoundException.class,
            ChannelNotFoundException.class,
            UnknownMaintenanceOperationException.class
    })
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        log.debug("Not found: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.ofNotFound(ex.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(RefreshAlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> handleConflict(RefreshAlreadyRunningException ex, HttpServletRequest request) {
        log.info("Refresh rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.ofConflict(ex.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("Access denied for URL: {}", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ErrorResponse.ofForbidden(request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.ofInternal(request.getRequestURI()));
    }
}
