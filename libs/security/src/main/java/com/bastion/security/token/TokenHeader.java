package com.bastion.security.token;

import com.bastion.security.AuthenticationException;
import com.bastion.security.AuthenticationFailure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;

import java.nio.charset.StandardCharsets;

/**
 * The JOSE header of a compact token, read without verifying anything.
 * <p>
 * Used to refuse foreign algorithms before the token reaches the parser, whatever the
 * declared name, and to report the key ID a freshly issued token was signed with.
 *
 * @param algorithm declared {@code alg}, null when absent or not a string
 * @param keyId     declared {@code kid}, null when absent or not a string
 */
public record TokenHeader(String algorithm, String keyId) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @throws AuthenticationException {@link AuthenticationFailure#MALFORMED_TOKEN} when the
     *                                 first segment is not base64url-encoded JSON
     */
    public static TokenHeader of(String token) {
        int end = token == null ? -1 : token.indexOf('.');
        if (end <= 0) {
            throw new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN, "Token has no header segment");
        }
        JsonNode header;
        try {
            byte[] json = Decoders.BASE64URL.decode(token.substring(0, end));
            header = MAPPER.readTree(new String(json, StandardCharsets.UTF_8));
        } catch (DecodingException | JsonProcessingException e) {
            throw new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN,
                    "Token header is not base64url JSON", e);
        }
        if (header == null || !header.isObject()) {
            throw new AuthenticationException(AuthenticationFailure.MALFORMED_TOKEN, "Token header is not a JSON object");
        }
        return new TokenHeader(text(header, "alg"), text(header, "kid"));
    }

    private static String text(JsonNode header, String field) {
        JsonNode value = header.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
