package com.example.signeddata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Decoded server notification. Exactly one of {@code data}, {@code summary} or
 * {@code externalPurchaseToken} is normally present.
 *
 * <p>The nested transaction and renewal info are only populated after their own
 * tokens passed the full verification pipeline; the envelope's signature is never
 * taken as evidence for them.
 */
public final class NotificationEnvelope extends ExtensibleModel implements DecodedPayload {

    private NotificationType notificationType;
    private Subtype subtype;
    @JsonProperty("notificationUUID")
    private String notificationUuid;
    private String version;
    private Long signedDate;
    private NotificationData data;
    private NotificationSummary summary;
    private ExternalPurchaseToken externalPurchaseToken;

    @JsonIgnore
    private TransactionInfo transactionInfo;
    @JsonIgnore
    private RenewalInfo renewalInfo;

    /**
     * Returns a copy of this envelope carrying the independently verified nested payloads.
     */
    public NotificationEnvelope withVerifiedPayloads(TransactionInfo transactionInfo, RenewalInfo renewalInfo) {
        NotificationEnvelope copy = new NotificationEnvelope();
        copy.notificationType = notificationType;
        copy.subtype = subtype;
        copy.notificationUuid = notificationUuid;
        copy.version = version;
        copy.signedDate = signedDate;
        copy.data = data;
        copy.summary = summary;
        copy.externalPurchaseToken = externalPurchaseToken;
        copy.transactionInfo = transactionInfo;
        copy.renewalInfo = renewalInfo;
        copy.copyAdditionalFieldsFrom(this);
        return copy;
    }

    @Override
    public PayloadKind kind() {
        return PayloadKind.NOTIFICATION;
    }

    public NotificationType getNotificationType() {
        return notificationType;
    }

    public Subtype getSubtype() {
        return subtype;
    }

    public String getNotificationUuid() {
        return notificationUuid;
    }

    public String getVersion() {
        return version;
    }

    public Long getSignedDate() {
        return signedDate;
    }

    public NotificationData getData() {
        return data;
    }

    public NotificationSummary getSummary() {
        return summary;
    }

    public ExternalPurchaseToken getExternalPurchaseToken() {
        return externalPurchaseToken;
    }

    public Optional<TransactionInfo> getTransactionInfo() {
        return Optional.ofNullable(transactionInfo);
    }

    public Optional<RenewalInfo> getRenewalInfo() {
        return Optional.ofNullable(renewalInfo);
    }

}
