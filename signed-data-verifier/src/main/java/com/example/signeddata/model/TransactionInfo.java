package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * A signed in-app purchase transaction. Dates are epoch milliseconds.
 */
public final class TransactionInfo extends ExtensibleModel implements DecodedPayload {

    private String originalTransactionId;
    private String transactionId;
    private String webOrderLineItemId;
    private String bundleId;
    private String productId;
    private String subscriptionGroupIdentifier;
    private Long purchaseDate;
    private Long originalPurchaseDate;
    private Long expiresDate;
    private Integer quantity;
    private ProductType type;
    private UUID appAccountToken;
    private InAppOwnershipType inAppOwnershipType;
    private Long signedDate;
    private Integer revocationReason;
    private Long revocationDate;
    @JsonProperty("isUpgraded")
    private Boolean upgraded;
    private Integer offerType;
    private String offerIdentifier;
    private Environment environment;
    private String storefront;
    private String storefrontId;
    private String transactionReason;
    private String currency;
    private Long price;
    private String offerDiscountType;
    private String appTransactionId;
    private String offerPeriod;

    @Override
    public PayloadKind kind() {
        return PayloadKind.TRANSACTION;
    }

    public String getOriginalTransactionId() {
        return originalTransactionId;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getWebOrderLineItemId() {
        return webOrderLineItemId;
    }

    public String getBundleId() {
        return bundleId;
    }

    public String getProductId() {
        return productId;
    }

    public String getSubscriptionGroupIdentifier() {
        return subscriptionGroupIdentifier;
    }

    public Long getPurchaseDate() {
        return purchaseDate;
    }

    public Long getOriginalPurchaseDate() {
        return originalPurchaseDate;
    }

    public Long getExpiresDate() {
        return expiresDate;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public ProductType getType() {
        return type;
    }

    public UUID getAppAccountToken() {
        return appAccountToken;
    }

    public InAppOwnershipType getInAppOwnershipType() {
        return inAppOwnershipType;
    }

    public Long getSignedDate() {
        return signedDate;
    }

    public Integer getRevocationReason() {
        return revocationReason;
    }

    public Long getRevocationDate() {
        return revocationDate;
    }

    public Boolean isUpgraded() {
        return upgraded;
    }

    public Integer getOfferType() {
        return offerType;
    }

    public String getOfferIdentifier() {
        return offerIdentifier;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public String getStorefront() {
        return storefront;
    }

    public String getStorefrontId() {
        return storefrontId;
    }

    public String getTransactionReason() {
        return transactionReason;
    }

    public String getCurrency() {
        return currency;
    }

    public Long getPrice() {
        return price;
    }

    public String getOfferDiscountType() {
        return offerDiscountType;
    }

    public String getAppTransactionId() {
        return appTransactionId;
    }

    public String getOfferPeriod() {
        return offerPeriod;
    }

}
