package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Subtype {

    INITIAL_BUY,
    RESUBSCRIBE,
    DOWNGRADE,
    UPGRADE,
    AUTO_RENEW_ENABLED,
    AUTO_RENEW_DISABLED,
    VOLUNTARY,
    BILLING_RETRY,
    PRICE_INCREASE,
    GRACE_PERIOD,
    PENDING,
    ACCEPTED,
    BILLING_RECOVERY,
    PRODUCT_NOT_FOR_SALE,
    SUMMARY,
    FAILURE,
    UNREPORTED,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name();
    }

    @JsonCreator
    public static Subtype fromValue(String value) {
        for (Subtype subtype : values()) {
            if (subtype.name().equals(value)) {
                return subtype;
            }
        }
        return UNKNOWN;
    }

}
