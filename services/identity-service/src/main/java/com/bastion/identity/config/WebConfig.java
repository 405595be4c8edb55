package com.bastion.identity.config;

import com.bastion.identity.infrastructure.web.CorrelationIdFilter;
import com.bastion.identity.infrastructure.web.RoleAuthorizationInterceptor;
import com.bastion.security.AuthPipeline;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Installs the {@code @RequireRole} gate on API handlers and the browser CORS policy.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final String API_PATTERN = "/api/**";

    private final AuthPipeline pipeline;
    private final IdentityProperties properties;

    public WebConfig(AuthPipeline pipeline, IdentityProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RoleAuthorizationInterceptor(pipeline)).addPathPatterns(API_PATTERN);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping(API_PATTERN)
                .allowedOrigins(properties.corsAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders(HttpHeaders.AUTHORIZATION, HttpHeaders.CONTENT_TYPE,
                        CorrelationIdFilter.CORRELATION_ID_HEADER)
                .exposedHeaders(CorrelationIdFilter.CORRELATION_ID_HEADER,
                        CorrelationIdFilter.REQUEST_ID_HEADER, CorrelationIdFilter.TRACE_ID_HEADER)
                .allowCredentials(true)
                .maxAge(3600);
    }
}
