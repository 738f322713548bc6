package com.example.signeddata.decode;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.VerificationError;
import com.example.signeddata.model.AppTransaction;
import com.example.signeddata.model.DecodedPayload;
import com.example.signeddata.model.NotificationData;
import com.example.signeddata.model.NotificationEnvelope;
import com.example.signeddata.model.PayloadKind;
import com.example.signeddata.model.RenewalInfo;
import com.example.signeddata.model.TransactionInfo;
import com.example.signeddata.model.UnknownPayload;
import com.example.signeddata.token.CompactToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import java.io.IOException;
import java.util.Map;

/**
 * Decodes the payload of a token whose signature has been verified and dispatches it to a
 * typed variant by the fields it carries. Tokens nested in a notification are handed back
 * to the full pipeline before the envelope is returned.
 */
public class PayloadDecoder {

    private static final Logger logger = LoggerFactory.getLogger(PayloadDecoder.class);

    static final String SIGNED_TRANSACTION_INFO = "data.signedTransactionInfo";
    static final String SIGNED_RENEWAL_INFO = "data.signedRenewalInfo";

    private static final TypeReference<Map<String, Object>> RAW_FIELDS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PayloadDecoder(ObjectMapper objectMapper) {
        Assert.notNull(objectMapper, "objectMapper must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes a payload of any shape; unrecognized shapes become {@link UnknownPayload}.
     */
    public DecodedPayload decode(CompactToken token, NestedTokenVerifier nestedVerifier)
            throws SignedDataVerificationException {
        return decode(token, null, nestedVerifier);
    }

    /**
     * Decodes a payload expected to be of the given kind. An unrecognized shape is decoded
     * into the expected type; a payload recognized as a different kind is rejected.
     */
    public DecodedPayload decode(CompactToken token, PayloadKind expectedKind, NestedTokenVerifier nestedVerifier)
            throws SignedDataVerificationException {

        JsonNode root = readPayload(token);
        PayloadKind detected = classify(root);

        if (expectedKind != null && detected != PayloadKind.UNKNOWN && detected != expectedKind) {
            throw new SignedDataVerificationException(VerificationError.MALFORMED_PAYLOAD,
                    "Expected a " + expectedKind + " payload but found a " + detected + " payload");
        }
        PayloadKind target = detected == PayloadKind.UNKNOWN && expectedKind != null ? expectedKind : detected;

        DecodedPayload payload = bind(root, target);
        if (payload instanceof NotificationEnvelope envelope) {
            payload = verifyNestedTokens(envelope, nestedVerifier);
        }
        logger.debug("Payload decoded as {}", payload.kind());
        return payload;
    }

    private JsonNode readPayload(CompactToken token) throws SignedDataVerificationException {
        JsonNode root;
        try {
            root = objectMapper.readTree(token.payloadSegment().decode());
        } catch (IOException e) {
            throw new SignedDataVerificationException(VerificationError.MALFORMED_PAYLOAD,
                    "Payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SignedDataVerificationException(VerificationError.MALFORMED_PAYLOAD,
                    "Payload is not a JSON object");
        }
        return root;
    }

    static PayloadKind classify(JsonNode root) {
        if (root.hasNonNull("notificationType")) {
            return PayloadKind.NOTIFICATION;
        }
        if (root.hasNonNull("receiptType")) {
            return PayloadKind.APP_TRANSACTION;
        }
        if (root.hasNonNull("transactionId")) {
            return PayloadKind.TRANSACTION;
        }
        if (root.hasNonNull("autoRenewStatus") || root.hasNonNull("autoRenewProductId")
                || root.hasNonNull("renewalDate")) {
            return PayloadKind.RENEWAL_INFO;
        }
        return PayloadKind.UNKNOWN;
    }

    private DecodedPayload bind(JsonNode root, PayloadKind kind) throws SignedDataVerificationException {
        try {
            switch (kind) {
                case NOTIFICATION:
                    return objectMapper.treeToValue(root, NotificationEnvelope.class);
                case TRANSACTION:
                    return objectMapper.treeToValue(root, TransactionInfo.class);
                case RENEWAL_INFO:
                    return objectMapper.treeToValue(root, RenewalInfo.class);
                case APP_TRANSACTION:
                    return objectMapper.treeToValue(root, AppTransaction.class);
                default:
                    return new UnknownPayload(objectMapper.convertValue(root, RAW_FIELDS));
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SignedDataVerificationException(VerificationError.MALFORMED_PAYLOAD,
                    "Payload does not match the " + kind + " shape", e);
        }
    }

    private NotificationEnvelope verifyNestedTokens(NotificationEnvelope envelope, NestedTokenVerifier nestedVerifier)
            throws SignedDataVerificationException {

        NotificationData data = envelope.getData();
        if (data == null) {
            return envelope;
        }

        TransactionInfo transactionInfo = null;
        if (data.getSignedTransactionInfo() != null) {
            try {
                transactionInfo = (TransactionInfo) nestedVerifier.verify(data.getSignedTransactionInfo(),
                        PayloadKind.TRANSACTION);
            } catch (SignedDataVerificationException e) {
                throw e.inField(SIGNED_TRANSACTION_INFO);
            }
        }

        RenewalInfo renewalInfo = null;
        if (data.getSignedRenewalInfo() != null) {
            try {
                renewalInfo = (RenewalInfo) nestedVerifier.verify(data.getSignedRenewalInfo(),
                        PayloadKind.RENEWAL_INFO);
            } catch (SignedDataVerificationException e) {
                throw e.inField(SIGNED_RENEWAL_INFO);
            }
        }

        return envelope.withVerifiedPayloads(transactionInfo, renewalInfo);
    }

}
