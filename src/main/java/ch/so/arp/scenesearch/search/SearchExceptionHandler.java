package ch.so.arp.scenesearch.search;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps search failures to JSON error bodies of the form
 * {@code {"error": code, "message": text}}.
 */
@RestControllerAdvice(assignableTypes = SceneSearchController.class)
public class SearchExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchExceptionHandler.class);

    @ExceptionHandler(InvalidWeightsException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidWeights(InvalidWeightsException ex) {
        LOGGER.debug("Rejected channel weights: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_weights", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", "request body is not valid JSON");
    }

    @ExceptionHandler(SearchFailedException.class)
    public ResponseEntity<Map<String, Object>> handleSearchFailed(SearchFailedException ex) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "search_failed", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
