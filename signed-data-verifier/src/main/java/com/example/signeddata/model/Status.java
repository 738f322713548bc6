package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subscription status carried in notification data, encoded as an integer code.
 */
public enum Status {

    ACTIVE(1),
    EXPIRED(2),
    BILLING_RETRY(3),
    BILLING_GRACE_PERIOD(4),
    REVOKED(5),
    UNKNOWN(-1);

    private final int code;

    Status(int code) {
        this.code = code;
    }

    @JsonValue
    public int code() {
        return code;
    }

    @JsonCreator
    public static Status fromCode(int code) {
        for (Status status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }

}
