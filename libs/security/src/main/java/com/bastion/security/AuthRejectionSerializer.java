package com.bastion.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes {@link AuthRejection} bodies as JSON for adapters that answer outside of a web
 * framework's own message conversion (servlet filters, interceptors).
 */
public final class AuthRejectionSerializer {

    public static final String CONTENT_TYPE = "application/json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AuthRejectionSerializer() {
        // utility class
    }

    /**
     * @throws RejectionSerializationException if Jackson fails, which for this fixed
     *                                         record shape means a broken classpath
     */
    public static byte[] toJson(AuthRejection rejection) {
        try {
            return MAPPER.writeValueAsBytes(rejection);
        } catch (JsonProcessingException e) {
            throw new RejectionSerializationException("Failed to serialize auth rejection", e);
        }
    }

    public static class RejectionSerializationException extends RuntimeException {
        public RejectionSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
