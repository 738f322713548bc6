package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProductType {

    AUTO_RENEWABLE("Auto-Renewable Subscription"),
    NON_CONSUMABLE("Non-Consumable"),
    CONSUMABLE("Consumable"),
    NON_RENEWING("Non-Renewing Subscription"),
    UNKNOWN("Unknown");

    private final String value;

    ProductType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ProductType fromValue(String value) {
        for (ProductType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }

}
