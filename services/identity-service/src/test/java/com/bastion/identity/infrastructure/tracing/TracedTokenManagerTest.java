package com.bastion.identity.infrastructure.tracing;

import com.bastion.observability.SpanHelper;
import com.bastion.security.AuthenticationException;
import com.bastion.security.event.AuthEventListener;
import com.bastion.security.event.AuthEventPublisher;
import com.bastion.security.event.AuthEventType;
import com.bastion.security.testing.TestIdentityFactory;
import com.bastion.security.token.JwtTokenManager;
import com.bastion.security.token.TokenHeader;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TracedTokenManager")
class TracedTokenManagerTest {

    private InMemorySpanExporter exporter;
    private SdkTracerProvider tracerProvider;
    private TracedTokenManager manager;

    @BeforeEach
    void setUp() {
        exporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build();
        manager = new TracedTokenManager(TestIdentityFactory.tokenManager(),
                new SpanHelper(tracerProvider.get("test")));
    }

    @AfterEach
    void tearDown() {
        tracerProvider.close();
    }

    private SpanData onlySpanNamed(String name) {
        List<SpanData> spans = exporter.getFinishedSpanItems().stream()
                .filter(span -> span.getName().equals(name))
                .toList();
        assertThat(spans).hasSize(1);
        return spans.get(0);
    }

    @Test
    @DisplayName("issue and validate each produce a span with identity attributes")
    void issueAndValidate() {
        String token = manager.issueToken("u1", "alice", List.of("user"), Duration.ofMinutes(5));
        manager.validateToken(token);

        SpanData generate = onlySpanNamed(TracedTokenManager.SPAN_GENERATE);
        assertThat(generate.getAttributes().get(AttributeKey.stringKey("user.id"))).isEqualTo("u1");
        assertThat(generate.getAttributes().get(AttributeKey.stringKey("jwt.ttl_seconds"))).isEqualTo("300");
        assertThat(generate.getAttributes().get(AttributeKey.stringKey("jwt.kid"))).isEqualTo("default");

        SpanData validate = onlySpanNamed(TracedTokenManager.SPAN_VALIDATE);
        assertThat(validate.getAttributes().get(AttributeKey.stringKey("user.id"))).isEqualTo("u1");
        assertThat(validate.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    @Test
    @DisplayName("the span names the key the token was signed with, even if a rotation follows at once")
    void keyIdFromIssuedToken() {
        var delegate = new AtomicReference<JwtTokenManager>();
        var rotated = new AtomicBoolean();
        AuthEventListener rotateAfterIssue = event -> {
            if (event.type() == AuthEventType.TOKEN_ISSUED && rotated.compareAndSet(false, true)) {
                delegate.get().rotateSigningKey("k2", TestIdentityFactory.OTHER_SECRET);
            }
        };
        delegate.set(TestIdentityFactory.tokenManager(Clock.systemUTC(), AuthEventPublisher.of(rotateAfterIssue)));
        var traced = new TracedTokenManager(delegate.get(), new SpanHelper(tracerProvider.get("test")));

        String token = traced.issueToken("u1", "alice", List.of(), Duration.ofMinutes(5));

        assertThat(traced.activeKeyId()).isEqualTo("k2");
        assertThat(TokenHeader.of(token).keyId()).isEqualTo("default");
        assertThat(onlySpanNamed(TracedTokenManager.SPAN_GENERATE).getAttributes()
                .get(AttributeKey.stringKey("jwt.kid"))).isEqualTo("default");
    }

    @Test
    @DisplayName("a rejected token marks the span as error and is re-thrown")
    void rejectedToken() {
        assertThatThrownBy(() -> manager.validateToken("invalid.jwt.token"))
                .isInstanceOf(AuthenticationException.class);

        SpanData validate = onlySpanNamed(TracedTokenManager.SPAN_VALIDATE);
        assertThat(validate.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(validate.getEvents()).anyMatch(event -> event.getName().equals("exception"));
    }

    @Test
    @DisplayName("rotation reports the new key ID and never the secret")
    void rotation() {
        String keyId = manager.rotateSigningKey("k2", TestIdentityFactory.OTHER_SECRET);

        SpanData rotate = onlySpanNamed(TracedTokenManager.SPAN_ROTATE);
        assertThat(rotate.getAttributes().get(AttributeKey.stringKey("jwt.kid"))).isEqualTo(keyId);
        assertThat(rotate.getAttributes().asMap().values())
                .noneMatch(value -> value.toString().contains(TestIdentityFactory.OTHER_SECRET));
        assertThat(manager.activeKeyId()).isEqualTo("k2");
    }
}
