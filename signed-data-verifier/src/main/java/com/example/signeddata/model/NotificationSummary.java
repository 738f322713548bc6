package com.example.signeddata.model;

import java.util.List;

/**
 * Outcome of a mass renewal-date extension request, sent in place of {@link NotificationData}.
 */
public final class NotificationSummary extends ExtensibleModel {

    private Environment environment;
    private Long appAppleId;
    private String bundleId;
    private String productId;
    private String requestIdentifier;
    private List<String> storefrontCountryCodes;
    private Long succeededCount;
    private Long failedCount;

    public Environment getEnvironment() {
        return environment;
    }

    public Long getAppAppleId() {
        return appAppleId;
    }

    public String getBundleId() {
        return bundleId;
    }

    public String getProductId() {
        return productId;
    }

    public String getRequestIdentifier() {
        return requestIdentifier;
    }

    public List<String> getStorefrontCountryCodes() {
        return storefrontCountryCodes;
    }

    public Long getSucceededCount() {
        return succeededCount;
    }

    public Long getFailedCount() {
        return failedCount;
    }

}
