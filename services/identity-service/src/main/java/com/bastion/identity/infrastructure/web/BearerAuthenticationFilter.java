package com.bastion.identity.infrastructure.web;

import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.AuthMode;
import com.bastion.security.AuthOutcome;
import com.bastion.security.AuthPipeline;
import com.bastion.security.IdentityContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Runs the auth pipeline for the URL patterns it is registered on.
 *
 * <p>One instance per {@link AuthMode}. A {@link AuthMode#REQUIRED} filter answers 401 and
 * stops the chain when no valid token is presented; an {@link AuthMode#OPTIONAL} filter
 * always continues. On success the caller is bound into the logging MDC for the rest of the
 * request.
 *
 * <p>Not a {@code @Component}: registered through {@code FilterRegistrationBean}s in
 * {@link com.bastion.identity.config.SecurityConfiguration} so that each mode gets its own
 * URL patterns.
 */
public class BearerAuthenticationFilter extends OncePerRequestFilter {

    private final AuthPipeline pipeline;
    private final AuthMode mode;

    public BearerAuthenticationFilter(AuthPipeline pipeline, AuthMode mode) {
        this.pipeline = pipeline;
        this.mode = mode;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        var exchange = new ServletAuthExchange(request, response);
        AuthOutcome outcome = pipeline.authenticate(exchange, mode);
        if (!outcome.proceed()) {
            return;
        }

        IdentityContext.identity(exchange).ifPresent(identity ->
                CorrelationContextHolder.bindIdentity(identity.subjectId(), identity.displayName()));
        filterChain.doFilter(request, response);
    }

    // Both modes share this class; keep their once-per-request markers apart.
    @Override
    protected String getAlreadyFilteredAttributeName() {
        return BearerAuthenticationFilter.class.getName() + "." + mode.name() + ALREADY_FILTERED_SUFFIX;
    }

    public AuthMode mode() {
        return mode;
    }
}
