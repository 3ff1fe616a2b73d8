package com.tally.metering.infrastructure.web;

import com.tally.eventmodel.EventSerializer.EventSerializationException;
import com.tally.metering.domain.error.IntegrityViolationException;
import com.tally.metering.domain.error.InvariantViolationException;
import com.tally.metering.domain.error.InvitationUnavailableException;
import com.tally.metering.domain.error.NotAMemberException;
import com.tally.metering.domain.error.NotFoundException;
import com.tally.metering.domain.error.ValidationException;
import com.tally.observability.CorrelationContextHolder;
import com.tally.security.AccessDeniedException;
import com.tally.security.TenantMismatchException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://tally.dev/errors/invariant-violation",
 *   "title": "Invariant Violation",
 *   "status": 409,
 *   "detail": "tenant t-1 already has an owner",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Limit advisories and duplicate events are not errors and never reach this class.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TYPE_BASE = "https://tally.dev/errors/";

    @ExceptionHandler(ValidationException.class)
    public ProblemDetail handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        EventSerializationException.class
    })
    public ProblemDetail handleMalformed(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request: " + rootMessage(ex));
    }

    @ExceptionHandler(MissingCallerIdentityException.class)
    public ProblemDetail handleMissingCaller(MissingCallerIdentityException ex) {
        log.warn("Unidentified caller: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", ex.getMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Access Denied", "access-denied", ex.getMessage());
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Tenant mismatch: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Tenant Mismatch", "tenant-mismatch", ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        log.info("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(NotAMemberException.class)
    public ProblemDetail handleNotAMember(NotAMemberException ex) {
        log.warn("Not a member: {}", ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Not A Member", "not-a-member", ex.getMessage());
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ProblemDetail handleInvariant(InvariantViolationException ex) {
        log.warn("Invariant violation: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Invariant Violation", "invariant-violation", ex.getMessage());
    }

    @ExceptionHandler(IntegrityViolationException.class)
    public ProblemDetail handleIntegrity(IntegrityViolationException ex) {
        log.error("Integrity violation: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Integrity Violation", "integrity-violation", ex.getMessage());
    }

    @ExceptionHandler(InvitationUnavailableException.class)
    public ProblemDetail handleInvitationUnavailable(InvitationUnavailableException ex) {
        log.info("Invitation unavailable: {}", ex.getMessage());
        return problem(HttpStatus.GONE, "Invitation Unavailable", "invitation-unavailable", ex.getMessage());
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ProblemDetail handleFrameworkError(Exception ex) {
        ProblemDetail problem = ((ErrorResponse) ex).getBody();
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal", "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    /** Adds the correlation ID clients quote when contacting support. */
    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }

    private static String rootMessage(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
