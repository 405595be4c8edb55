package com.bastion.security;

/**
 * Thrown when the signing secret is missing or unusable.
 * <p>
 * Not recoverable by the request pipeline: at startup it aborts boot, on rotation the
 * previous key stays active and the operator sees the failure.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
