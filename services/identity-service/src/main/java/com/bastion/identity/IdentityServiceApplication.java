package com.bastion.identity;

import com.bastion.identity.config.IdentityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Bastion identity service.
 *
 * <p>Hosts the bearer-token auth pipeline behind HTTP, and exposes token minting, refresh
 * and signing-key rotation to operators. Configured by default with:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID and caller identity in every log line
 *   <li>RFC 7807 ProblemDetail for non-auth errors
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(IdentityProperties.class)
public class IdentityServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(IdentityServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(IdentityServiceApplication.class, args);
        log.info("Bastion identity service started successfully");
    }
}
