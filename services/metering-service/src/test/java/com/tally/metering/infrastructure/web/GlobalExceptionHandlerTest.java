package com.tally.metering.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.tally.metering.domain.error.InvariantViolationException;
import com.tally.metering.domain.error.ValidationException;
import com.tally.observability.CorrelationContext;
import com.tally.observability.CorrelationContextHolder;
import com.tally.security.AccessDeniedException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps validation failures to 400 with the individual errors")
    void validation() {
        ProblemDetail result = handler.handleValidation(new ValidationException(List.of("a is bad", "b is bad")));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Validation Error");
        assertThat(result.getType().toString()).isEqualTo("https://tally.dev/errors/validation");
        assertThat(result.getProperties()).containsEntry("errors", List.of("a is bad", "b is bad"));
    }

    @Test
    @DisplayName("maps a missing caller to 401")
    void missingCaller() {
        ProblemDetail result = handler.handleMissingCaller(new MissingCallerIdentityException("missing X-User-ID header"));

        assertThat(result.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("maps access denial to 403")
    void accessDenied() {
        ProblemDetail result =
                handler.handleAccessDenied(new AccessDeniedException("bob", "remove member", "requires admin"));

        assertThat(result.getStatus()).isEqualTo(403);
    }

    @Test
    @DisplayName("maps invariant violations to 409")
    void invariant() {
        ProblemDetail result =
                handler.handleInvariant(new InvariantViolationException("tenant t-1 already has an owner"));

        assertThat(result.getStatus()).isEqualTo(409);
        assertThat(result.getDetail()).isEqualTo("tenant t-1 already has an owner");
    }

    @Test
    @DisplayName("hides the cause of unexpected errors")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("connection string leaked"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).doesNotContain("connection string");
    }

    @Test
    @DisplayName("adds the timestamp and the request's correlation ID")
    void correlation() {
        CorrelationContextHolder.set(new CorrelationContext("corr-1", null, null, "req-1"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-1");
    }
}
