package com.example.signeddata.model;

/**
 * External purchase token reported by an {@code EXTERNAL_PURCHASE_TOKEN} notification.
 * Carries no environment of its own; sandbox tokens are recognised by their id prefix.
 */
public final class ExternalPurchaseToken extends ExtensibleModel {

    static final String SANDBOX_ID_PREFIX = "SANDBOX";

    private String externalPurchaseId;
    private Long tokenCreationDate;
    private Long appAppleId;
    private String bundleId;

    public String getExternalPurchaseId() {
        return externalPurchaseId;
    }

    public Long getTokenCreationDate() {
        return tokenCreationDate;
    }

    public Long getAppAppleId() {
        return appAppleId;
    }

    public String getBundleId() {
        return bundleId;
    }

    public Environment deriveEnvironment() {
        if (externalPurchaseId != null && externalPurchaseId.startsWith(SANDBOX_ID_PREFIX)) {
            return Environment.SANDBOX;
        }
        return Environment.PRODUCTION;
    }

}
