package com.bastion.identity.infrastructure.web;

import com.bastion.security.AuthPipeline;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces {@link RequireRole} on controller handlers through the auth pipeline's role gate.
 * A refused request is answered with 403 and the handler never runs.
 */
public class RoleAuthorizationInterceptor implements HandlerInterceptor {

    private final AuthPipeline pipeline;

    public RoleAuthorizationInterceptor(AuthPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        RequireRole requirement = requiredRole(method);
        if (requirement == null) {
            return true;
        }
        return pipeline.authorize(new ServletAuthExchange(request, response), requirement.value()).proceed();
    }

    private static RequireRole requiredRole(HandlerMethod method) {
        RequireRole onMethod = AnnotatedElementUtils.findMergedAnnotation(method.getMethod(), RequireRole.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequireRole.class);
    }
}
