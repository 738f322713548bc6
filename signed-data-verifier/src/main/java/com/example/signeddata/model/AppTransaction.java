package com.example.signeddata.model;

import java.util.UUID;

/**
 * Signed record of the app's original install or purchase.
 * {@code receiptType} names the environment the record was issued in.
 */
public final class AppTransaction extends ExtensibleModel implements DecodedPayload {

    private Environment receiptType;
    private Long appAppleId;
    private String bundleId;
    private String applicationVersion;
    private Long versionExternalIdentifier;
    private Long receiptCreationDate;
    private Long originalPurchaseDate;
    private String originalApplicationVersion;
    private String deviceVerification;
    private UUID deviceVerificationNonce;
    private Long preorderDate;
    private Long signedDate;
    private String appTransactionId;
    private String originalPlatform;

    @Override
    public PayloadKind kind() {
        return PayloadKind.APP_TRANSACTION;
    }

    public Environment getReceiptType() {
        return receiptType;
    }

    public Long getAppAppleId() {
        return appAppleId;
    }

    public String getBundleId() {
        return bundleId;
    }

    public String getApplicationVersion() {
        return applicationVersion;
    }

    public Long getVersionExternalIdentifier() {
        return versionExternalIdentifier;
    }

    public Long getReceiptCreationDate() {
        return receiptCreationDate;
    }

    public Long getOriginalPurchaseDate() {
        return originalPurchaseDate;
    }

    public String getOriginalApplicationVersion() {
        return originalApplicationVersion;
    }

    public String getDeviceVerification() {
        return deviceVerification;
    }

    public UUID getDeviceVerificationNonce() {
        return deviceVerificationNonce;
    }

    public Long getPreorderDate() {
        return preorderDate;
    }

    public Long getSignedDate() {
        return signedDate;
    }

    public String getAppTransactionId() {
        return appTransactionId;
    }

    public String getOriginalPlatform() {
        return originalPlatform;
    }

}
