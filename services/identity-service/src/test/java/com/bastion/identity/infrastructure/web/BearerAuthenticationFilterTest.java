package com.bastion.identity.infrastructure.web;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.AuthMode;
import com.bastion.security.AuthPipeline;
import com.bastion.security.IdentityContext;
import com.bastion.security.event.AuthEventPublisher;
import com.bastion.security.testing.TestIdentityFactory;
import com.bastion.security.token.JwtTokenManager;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerAuthenticationFilter")
class BearerAuthenticationFilterTest {

    private JwtTokenManager tokenManager;
    private AuthPipeline pipeline;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;
    private AtomicBoolean chainInvoked;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        tokenManager = TestIdentityFactory.tokenManager();
        pipeline = new AuthPipeline(tokenManager, AuthEventPublisher.noop());
        request = new MockHttpServletRequest("GET", "/api/v1/me");
        response = new MockHttpServletResponse();
        chainInvoked = new AtomicBoolean();
        chain = (req, resp) -> chainInvoked.set(true);
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private String bearer(String... roles) {
        return "Bearer " + tokenManager.issueToken("u1", "alice", List.of(roles), Duration.ofMinutes(15));
    }

    @Nested
    @DisplayName("required mode")
    class Required {

        private BearerAuthenticationFilter filter;

        @BeforeEach
        void createFilter() {
            filter = new BearerAuthenticationFilter(pipeline, AuthMode.REQUIRED);
        }

        @Test
        @DisplayName("writes 401 JSON and stops the chain without a token")
        void rejects() throws Exception {
            filter.doFilter(request, response, chain);

            assertThat(chainInvoked).isFalse();
            assertThat(response.getStatus()).isEqualTo(401);
            assertThat(response.getContentType()).startsWith("application/json");
            assertThat(response.getContentAsString())
                    .contains("\"error\":\"Missing or invalid authorization header\"")
                    .contains("\"code\":\"UNAUTHORIZED\"");
        }

        @Test
        @DisplayName("attaches the identity and binds it into the logging context")
        void authenticates() throws Exception {
            CorrelationContextHolder.set(CorrelationContext.forRequest("cid-1"));
            request.addHeader("Authorization", bearer("user"));
            var mdcUser = new AtomicReference<String>();
            FilterChain capturing = (req, resp) -> {
                chainInvoked.set(true);
                mdcUser.set(MDC.get(CorrelationContext.MDC_SUBJECT_ID));
            };

            filter.doFilter(request, response, capturing);

            assertThat(chainInvoked).isTrue();
            assertThat(IdentityContext.subjectId(new ServletAttributeStore(request))).contains("u1");
            assertThat(mdcUser.get()).isEqualTo("u1");
            assertThat(CorrelationContextHolder.get()).get()
                    .extracting(CorrelationContext::username).isEqualTo("alice");
        }
    }

    @Nested
    @DisplayName("optional mode")
    class OptionalMode {

        private BearerAuthenticationFilter filter;

        @BeforeEach
        void createFilter() {
            filter = new BearerAuthenticationFilter(pipeline, AuthMode.OPTIONAL);
        }

        @Test
        @DisplayName("continues anonymously with an invalid token")
        void continuesAnonymously() throws Exception {
            request.addHeader("Authorization", "Bearer invalid.jwt.token");

            filter.doFilter(request, response, chain);

            assertThat(chainInvoked).isTrue();
            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(IdentityContext.isAuthenticated(new ServletAttributeStore(request))).isFalse();
        }
    }

    @Test
    @DisplayName("required and optional filters keep separate once-per-request markers")
    void separateMarkers() throws Exception {
        request.addHeader("Authorization", bearer("user"));
        var optional = new BearerAuthenticationFilter(pipeline, AuthMode.OPTIONAL);
        var required = new BearerAuthenticationFilter(pipeline, AuthMode.REQUIRED);
        var requiredRan = new AtomicBoolean();

        optional.doFilter(request, response, (req, resp) ->
                required.doFilter(req, resp, (req2, resp2) -> requiredRan.set(true)));

        assertThat(requiredRan).isTrue();
        assertThat(required.mode()).isEqualTo(AuthMode.REQUIRED);
    }
}
