package com.tally.metering.infrastructure.web;

import com.tally.observability.CorrelationContextHolder;
import com.tally.security.ActorType;
import com.tally.security.CallerContext;
import com.tally.security.CallerContextValidator;
import com.tally.security.SecurityValidationResult;
import java.util.Locale;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link CallerContext} controller parameter from request headers.
 *
 * <p>{@code X-User-ID} is required. {@code X-Actor-Type} may say {@code API}; system callers
 * cannot be asserted over HTTP.
 */
public class CallerContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ACTOR_TYPE_HEADER = "X-Actor-Type";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerContext.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        String userId = webRequest.getHeader(CorrelationIdFilter.USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            throw new MissingCallerIdentityException("missing " + CorrelationIdFilter.USER_ID_HEADER + " header");
        }
        String tenantId = webRequest.getHeader(CorrelationIdFilter.TENANT_ID_HEADER);
        String actorHeader = webRequest.getHeader(ACTOR_TYPE_HEADER);
        ActorType actorType =
                actorHeader != null && "api".equals(actorHeader.trim().toLowerCase(Locale.ROOT))
                        ? ActorType.API
                        : ActorType.USER;
        var caller =
                new CallerContext(
                        userId.trim(),
                        tenantId == null || tenantId.isBlank() ? null : tenantId.trim(),
                        actorType,
                        CorrelationContextHolder.currentCorrelationId().orElse(null));
        SecurityValidationResult validation = CallerContextValidator.validate(caller);
        if (!validation.valid()) {
            throw new MissingCallerIdentityException(String.join("; ", validation.errors()));
        }
        return caller;
    }
}
