package com.bastion.identity.config;

import com.bastion.identity.infrastructure.events.LoggingAuthEventListener;
import com.bastion.identity.infrastructure.events.MeteredAuthEventListener;
import com.bastion.identity.infrastructure.grpc.GrpcAuthInterceptor;
import com.bastion.identity.infrastructure.grpc.GrpcCorrelationInterceptor;
import com.bastion.identity.infrastructure.grpc.GrpcExceptionInterceptor;
import com.bastion.identity.infrastructure.grpc.GrpcInterceptorChain;
import com.bastion.identity.infrastructure.tracing.TracedTokenManager;
import com.bastion.identity.infrastructure.web.BearerAuthenticationFilter;
import com.bastion.observability.MetricFactory;
import com.bastion.observability.SpanHelper;
import com.bastion.security.AuthMode;
import com.bastion.security.AuthPipeline;
import com.bastion.security.event.AuthEventListener;
import com.bastion.security.event.AuthEventPublisher;
import com.bastion.security.token.EnvironmentSecretSource;
import com.bastion.security.token.JwtTokenManager;
import com.bastion.security.token.SecretSource;
import com.bastion.security.token.StaticSecretSource;
import com.bastion.security.token.TokenManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.util.List;

/**
 * Wires the token manager and the auth pipeline into the servlet container.
 *
 * <p>The token manager is built once at startup and fails closed: a missing or too short
 * signing secret aborts startup with a {@link com.bastion.security.ConfigurationException}.
 * Required-mode and optional-mode filters are registered on the URL patterns from
 * {@link IdentityProperties}, after the correlation filter.
 */
@Configuration
public class SecurityConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfiguration.class);

    public static final String INSTRUMENTATION_NAME = "bastion-identity";
    public static final int REQUIRED_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;
    public static final int OPTIONAL_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 20;

    @Bean
    public SecretSource secretSource(IdentityProperties properties) {
        if (properties.hasLiteralSecret()) {
            if ("production".equalsIgnoreCase(properties.environment())) {
                log.warn("Literal signing secret configured in production; prefer {}",
                        properties.secretEnvVariable());
            }
            return new StaticSecretSource(properties.secret());
        }
        return new EnvironmentSecretSource(properties.secretEnvVariable());
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, IdentityProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public LoggingAuthEventListener loggingAuthEventListener() {
        return new LoggingAuthEventListener();
    }

    @Bean
    public MeteredAuthEventListener meteredAuthEventListener(MetricFactory metricFactory) {
        return new MeteredAuthEventListener(metricFactory);
    }

    @Bean
    public AuthEventPublisher authEventPublisher(List<AuthEventListener> listeners) {
        return new AuthEventPublisher(listeners);
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Bean
    public TokenManager tokenManager(
            SecretSource secretSource,
            IdentityProperties properties,
            AuthEventPublisher authEventPublisher,
            SpanHelper spanHelper) {
        JwtTokenManager jwt = JwtTokenManager.builder(secretSource)
                .initialKeyId(properties.initialKeyId())
                .retainedKeys(properties.retainedKeys())
                .eventPublisher(authEventPublisher)
                .build();
        return new TracedTokenManager(jwt, spanHelper);
    }

    @Bean
    public AuthPipeline authPipeline(TokenManager tokenManager, AuthEventPublisher authEventPublisher) {
        return new AuthPipeline(tokenManager, authEventPublisher);
    }

    @Bean
    public FilterRegistrationBean<BearerAuthenticationFilter> requiredAuthenticationFilter(
            AuthPipeline pipeline, IdentityProperties properties) {
        return registration(pipeline, AuthMode.REQUIRED, properties.requiredPaths(), REQUIRED_FILTER_ORDER);
    }

    @Bean
    public FilterRegistrationBean<BearerAuthenticationFilter> optionalAuthenticationFilter(
            AuthPipeline pipeline, IdentityProperties properties) {
        return registration(pipeline, AuthMode.OPTIONAL, properties.optionalPaths(), OPTIONAL_FILTER_ORDER);
    }

    @Bean
    public GrpcAuthInterceptor grpcAuthInterceptor(AuthPipeline pipeline, IdentityProperties properties) {
        return new GrpcAuthInterceptor(pipeline, AuthMode.REQUIRED, properties.grpcMethodRoles());
    }

    @Bean
    public GrpcInterceptorChain grpcInterceptorChain(GrpcAuthInterceptor authInterceptor) {
        return new GrpcInterceptorChain(
                new GrpcExceptionInterceptor(), new GrpcCorrelationInterceptor(), authInterceptor);
    }

    private static FilterRegistrationBean<BearerAuthenticationFilter> registration(
            AuthPipeline pipeline, AuthMode mode, List<String> urlPatterns, int order) {
        var registration = new FilterRegistrationBean<>(new BearerAuthenticationFilter(pipeline, mode));
        registration.setName("bearerAuthentication" + (mode == AuthMode.REQUIRED ? "Required" : "Optional"));
        registration.setUrlPatterns(urlPatterns);
        registration.setOrder(order);
        log.info("Auth filter {} mapped to {}", mode, urlPatterns);
        return registration;
    }
}
