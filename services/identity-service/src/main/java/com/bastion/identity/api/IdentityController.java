package com.bastion.identity.api;

import com.bastion.identity.infrastructure.web.ServletAttributeStore;
import com.bastion.security.IdentityContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Introspection of the authenticated caller. Mapped under a required-mode path, so an
 * anonymous request never reaches the handler.
 */
@RestController
@RequestMapping("/api/v1")
public class IdentityController {

    @GetMapping("/me")
    public IdentityResponse me(HttpServletRequest request) {
        return IdentityResponse.from(IdentityContext.require(new ServletAttributeStore(request)));
    }
}
