package com.bastion.identity.infrastructure.web;

import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.AuthRejection;
import com.bastion.security.AuthenticationException;
import com.bastion.security.AuthorizationException;
import com.bastion.security.ConfigurationException;
import com.bastion.security.SigningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps exceptions thrown by controllers to HTTP responses.
 *
 * <p>Authentication and authorization failures use the same {@code {"error","code","status"}}
 * body as the auth filters, with the generic messages only. Everything else becomes an RFC 7807
 * {@link ProblemDetail} carrying a timestamp and the correlation ID:
 *
 * <pre>
 * {
 *   "type": "https://bastion.dev/errors/bad-request",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "ttl must not be null or zero",
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<AuthRejection> handleAuthentication(AuthenticationException ex) {
        log.warn("Authentication failed: reason={}", ex.failure().code());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(AuthRejection.unauthorized(ex.failure()));
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<AuthRejection> handleAuthorization(AuthorizationException ex) {
        log.warn("Authorization failed: reason={}, required_role={}", ex.failure().code(), ex.requiredRole());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(AuthRejection.forbidden(ex.failure()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is missing or malformed");
    }

    @ExceptionHandler({SigningException.class, ConfigurationException.class})
    public ProblemDetail handleTokenInfrastructure(RuntimeException ex) {
        log.error("Token infrastructure failure", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        // Framework exceptions (unknown route, wrong method, bad media type) carry their own status.
        if (ex instanceof ErrorResponse errorResponse && !errorResponse.getStatusCode().is5xxServerError()) {
            log.debug("Request refused by MVC: {}", ex.getMessage());
            ProblemDetail problem = errorResponse.getBody();
            enrich(problem);
            return problem;
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://bastion.dev/errors/" + type));
        enrich(problem);
        return problem;
    }

    private static void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
