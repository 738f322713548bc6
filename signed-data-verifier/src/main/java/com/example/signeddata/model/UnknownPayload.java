package com.example.signeddata.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verified payload whose shape matches none of the known variants.
 */
public record UnknownPayload(Map<String, Object> fields) implements DecodedPayload {

    public UnknownPayload {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public PayloadKind kind() {
        return PayloadKind.UNKNOWN;
    }

    @Override
    public Map<String, Object> additionalFields() {
        return fields;
    }

}
