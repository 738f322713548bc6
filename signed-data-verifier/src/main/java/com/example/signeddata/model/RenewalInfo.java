package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Signed renewal state of an auto-renewable subscription. Dates are epoch milliseconds.
 */
public final class RenewalInfo extends ExtensibleModel implements DecodedPayload {

    private Integer expirationIntent;
    private String originalTransactionId;
    private String autoRenewProductId;
    private String productId;
    private Integer autoRenewStatus;
    @JsonProperty("isInBillingRetryPeriod")
    private Boolean inBillingRetryPeriod;
    private Integer priceIncreaseStatus;
    private Long gracePeriodExpiresDate;
    private Integer offerType;
    private String offerIdentifier;
    private Long signedDate;
    private Environment environment;
    private Long recentSubscriptionStartDate;
    private Long renewalDate;
    private String currency;
    private Long renewalPrice;
    private String offerDiscountType;
    private List<String> eligibleWinBackOfferIds;
    private UUID appAccountToken;
    private String appTransactionId;
    private String offerPeriod;

    @Override
    public PayloadKind kind() {
        return PayloadKind.RENEWAL_INFO;
    }

    public Integer getExpirationIntent() {
        return expirationIntent;
    }

    public String getOriginalTransactionId() {
        return originalTransactionId;
    }

    public String getAutoRenewProductId() {
        return autoRenewProductId;
    }

    public String getProductId() {
        return productId;
    }

    public Integer getAutoRenewStatus() {
        return autoRenewStatus;
    }

    public Boolean isInBillingRetryPeriod() {
        return inBillingRetryPeriod;
    }

    public Integer getPriceIncreaseStatus() {
        return priceIncreaseStatus;
    }

    public Long getGracePeriodExpiresDate() {
        return gracePeriodExpiresDate;
    }

    public Integer getOfferType() {
        return offerType;
    }

    public String getOfferIdentifier() {
        return offerIdentifier;
    }

    public Long getSignedDate() {
        return signedDate;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public Long getRecentSubscriptionStartDate() {
        return recentSubscriptionStartDate;
    }

    public Long getRenewalDate() {
        return renewalDate;
    }

    public String getCurrency() {
        return currency;
    }

    public Long getRenewalPrice() {
        return renewalPrice;
    }

    public String getOfferDiscountType() {
        return offerDiscountType;
    }

    public List<String> getEligibleWinBackOfferIds() {
        return eligibleWinBackOfferIds;
    }

    public UUID getAppAccountToken() {
        return appAccountToken;
    }

    public String getAppTransactionId() {
        return appTransactionId;
    }

    public String getOfferPeriod() {
        return offerPeriod;
    }

}
