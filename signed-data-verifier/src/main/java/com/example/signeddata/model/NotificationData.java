package com.example.signeddata.model;

/**
 * App and subscription context of a notification. The signed transaction and renewal
 * fields are compact tokens in their own right and are verified independently.
 */
public final class NotificationData extends ExtensibleModel {

    private Environment environment;
    private Long appAppleId;
    private String bundleId;
    private String bundleVersion;
    private String signedTransactionInfo;
    private String signedRenewalInfo;
    private Status status;

    public Environment getEnvironment() {
        return environment;
    }

    public Long getAppAppleId() {
        return appAppleId;
    }

    public String getBundleId() {
        return bundleId;
    }

    public String getBundleVersion() {
        return bundleVersion;
    }

    public String getSignedTransactionInfo() {
        return signedTransactionInfo;
    }

    public String getSignedRenewalInfo() {
        return signedRenewalInfo;
    }

    public Status getStatus() {
        return status;
    }

}
