package com.imaginarium.orchestrator.node;

/**
 * How a node failure should be treated.
 *
 * TRANSIENT: network error, timeout, provider rate limit: worth retrying.
 * PERMANENT: invalid config or unrecoverable error: retrying cannot help.
 */
public enum ErrorClassification {
    TRANSIENT,
    PERMANENT
}
