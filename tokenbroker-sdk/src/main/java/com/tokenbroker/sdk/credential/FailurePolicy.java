package com.tokenbroker.sdk.credential;

/**
 * What the resolver does when an applicable strategy fails.
 */
public enum FailurePolicy {
    /** Record the failure and try the next strategy. */
    CONTINUE,
    /** Stop resolution and report the failure immediately. */
    ABORT
}
