package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum InAppOwnershipType {

    FAMILY_SHARED,
    PURCHASED,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name();
    }

    @JsonCreator
    public static InAppOwnershipType fromValue(String value) {
        for (InAppOwnershipType type : values()) {
            if (type.name().equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }

}
