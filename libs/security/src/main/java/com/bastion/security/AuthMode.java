package com.bastion.security;

/**
 * How the pipeline treats a request without a valid bearer token.
 */
public enum AuthMode {

    /** Reject with 401 and stop the chain. */
    REQUIRED,

    /** Continue anonymously. Never rejects on authentication grounds. */
    OPTIONAL
}
