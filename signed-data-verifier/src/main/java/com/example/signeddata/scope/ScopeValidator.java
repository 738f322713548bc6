package com.example.signeddata.scope;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.VerificationContext;
import com.example.signeddata.VerificationError;
import com.example.signeddata.model.AppTransaction;
import com.example.signeddata.model.DecodedPayload;
import com.example.signeddata.model.Environment;
import com.example.signeddata.model.ExternalPurchaseToken;
import com.example.signeddata.model.NotificationData;
import com.example.signeddata.model.NotificationEnvelope;
import com.example.signeddata.model.NotificationSummary;
import com.example.signeddata.model.RenewalInfo;
import com.example.signeddata.model.TransactionInfo;
import com.example.signeddata.model.UnknownPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Checks that a verified payload was issued for the expected app and environment.
 */
public class ScopeValidator {

    private static final Logger logger = LoggerFactory.getLogger(ScopeValidator.class);

    public void validate(DecodedPayload payload, VerificationContext context) throws SignedDataVerificationException {
        Scope scope = scopeOf(payload);

        if (scope.checksBundleId() && !context.bundleId().equals(scope.bundleId())) {
            throw new SignedDataVerificationException(VerificationError.INVALID_BUNDLE_ID,
                    "Payload bundle id " + scope.bundleId() + " does not match " + context.bundleId());
        }
        if (context.appAppleId() != null && scope.appAppleId() != null
                && !context.appAppleId().equals(scope.appAppleId())) {
            throw new SignedDataVerificationException(VerificationError.INVALID_APP_IDENTIFIER,
                    "Payload app apple id " + scope.appAppleId() + " does not match " + context.appAppleId());
        }
        if (scope.environment() != context.environment()) {
            throw new SignedDataVerificationException(VerificationError.INVALID_ENVIRONMENT,
                    "Payload environment " + scope.environment() + " does not match " + context.environment());
        }
        logger.debug("Payload scope matches bundle {} in {}", context.bundleId(), context.environment());
    }

    private Scope scopeOf(DecodedPayload payload) {
        if (payload instanceof TransactionInfo transaction) {
            return new Scope(true, transaction.getBundleId(), null, transaction.getEnvironment());
        }
        if (payload instanceof AppTransaction appTransaction) {
            return new Scope(true, appTransaction.getBundleId(), appTransaction.getAppAppleId(),
                    appTransaction.getReceiptType());
        }
        if (payload instanceof RenewalInfo renewal) {
            // renewal info carries no bundle id
            return new Scope(false, null, null, renewal.getEnvironment());
        }
        if (payload instanceof NotificationEnvelope envelope) {
            return scopeOf(envelope);
        }
        return scopeOf((UnknownPayload) payload);
    }

    private Scope scopeOf(NotificationEnvelope envelope) {
        NotificationData data = envelope.getData();
        if (data != null) {
            return new Scope(true, data.getBundleId(), data.getAppAppleId(), data.getEnvironment());
        }
        NotificationSummary summary = envelope.getSummary();
        if (summary != null) {
            return new Scope(true, summary.getBundleId(), summary.getAppAppleId(), summary.getEnvironment());
        }
        ExternalPurchaseToken externalPurchaseToken = envelope.getExternalPurchaseToken();
        if (externalPurchaseToken != null) {
            return new Scope(true, externalPurchaseToken.getBundleId(), externalPurchaseToken.getAppAppleId(),
                    externalPurchaseToken.deriveEnvironment());
        }
        return new Scope(true, null, null, null);
    }

    private Scope scopeOf(UnknownPayload payload) {
        Map<String, Object> fields = payload.fields();
        Object bundleId = fields.get("bundleId");
        Object appAppleId = fields.get("appAppleId");
        Object environment = fields.get("environment");
        return new Scope(bundleId != null, Objects.toString(bundleId, null),
                appAppleId instanceof Number number ? Long.valueOf(number.longValue()) : null,
                environment == null ? null : Environment.fromValue(environment.toString()));
    }

    private record Scope(boolean checksBundleId, String bundleId, Long appAppleId, Environment environment) {
    }

}
