package com.example.signeddata.model;

import java.util.Map;

/**
 * A payload whose signature and certificate chain have been verified.
 */
public sealed interface DecodedPayload
        permits NotificationEnvelope, TransactionInfo, RenewalInfo, AppTransaction, UnknownPayload {

    PayloadKind kind();

    /**
     * Fields present in the payload that this model does not map to a typed property.
     */
    Map<String, Object> additionalFields();

}
