package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {

    SUBSCRIBED,
    DID_CHANGE_RENEWAL_PREF,
    DID_CHANGE_RENEWAL_STATUS,
    OFFER_REDEEMED,
    DID_RENEW,
    EXPIRED,
    DID_FAIL_TO_RENEW,
    GRACE_PERIOD_EXPIRED,
    PRICE_INCREASE,
    REFUND,
    REFUND_DECLINED,
    CONSUMPTION_REQUEST,
    RENEWAL_EXTENDED,
    REVOKE,
    TEST,
    RENEWAL_EXTENSION,
    REFUND_REVERSED,
    EXTERNAL_PURCHASE_TOKEN,
    ONE_TIME_CHARGE,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name();
    }

    @JsonCreator
    public static NotificationType fromValue(String value) {
        for (NotificationType type : values()) {
            if (type.name().equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }

}
