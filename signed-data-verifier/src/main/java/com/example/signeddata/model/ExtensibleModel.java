package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for payload models that keep unmapped JSON fields, so values added by the
 * platform after this model was written are still available to callers.
 */
public abstract class ExtensibleModel {

    private final Map<String, Object> additionalFields = new LinkedHashMap<>();

    @JsonAnySetter
    void putAdditionalField(String name, Object value) {
        additionalFields.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> additionalFields() {
        return Collections.unmodifiableMap(additionalFields);
    }

    void copyAdditionalFieldsFrom(ExtensibleModel other) {
        additionalFields.putAll(other.additionalFields);
    }

}
