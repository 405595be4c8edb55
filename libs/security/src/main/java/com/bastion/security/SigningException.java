package com.bastion.security;

/**
 * Thrown when a token cannot be signed. Indicates a key or crypto-provider problem,
 * never a caller mistake, so the HTTP boundary answers 500.
 */
public class SigningException extends RuntimeException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
