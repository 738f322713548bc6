package com.example.signeddata.model;

/**
 * Shapes a verified payload can decode into.
 */
public enum PayloadKind {
    NOTIFICATION,
    TRANSACTION,
    RENEWAL_INFO,
    APP_TRANSACTION,
    UNKNOWN
}
