package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Deployment environment a payload was issued in. Sandbox and Production are
 * separate signing domains; Xcode and LocalTesting only appear in locally generated data.
 */
public enum Environment {

    SANDBOX("Sandbox"),
    PRODUCTION("Production"),
    XCODE("Xcode"),
    LOCAL_TESTING("LocalTesting"),
    UNKNOWN("Unknown");

    private final String value;

    Environment(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Environment fromValue(String value) {
        for (Environment environment : values()) {
            if (environment.value.equals(value)) {
                return environment;
            }
        }
        return UNKNOWN;
    }

}
