package com.bastion.identity.api;

import com.bastion.identity.config.IdentityProperties;
import com.bastion.identity.infrastructure.web.ServletAttributeStore;
import com.bastion.security.IdentityContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service info endpoint. Served in optional mode: anonymous callers get the same answer as
 * authenticated ones, minus their subject ID.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final IdentityProperties properties;

    public ServiceInfoController(IdentityProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo(HttpServletRequest request) {
        var attributes = new ServletAttributeStore(request);
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("status", "running");
        info.put("timestamp", Instant.now().toString());
        info.put("authenticated", IdentityContext.isAuthenticated(attributes));
        IdentityContext.subjectId(attributes).ifPresent(subjectId -> info.put("subjectId", subjectId));
        return info;
    }
}
