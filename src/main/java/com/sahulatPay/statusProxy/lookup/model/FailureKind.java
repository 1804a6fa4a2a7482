package com.sahulatPay.statusProxy.lookup.model;

/**
 * Reason a single lookup could not produce an upstream record.
 */
public enum FailureKind {
    TIMEOUT,
    ERROR
}
