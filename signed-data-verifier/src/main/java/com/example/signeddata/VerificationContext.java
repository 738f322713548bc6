package com.example.signeddata;

import com.example.signeddata.model.Environment;
import com.example.signeddata.revocation.RevocationFailurePolicy;
import org.springframework.util.Assert;

import java.time.Clock;

/**
 * Caller expectations every decoded payload is checked against.
 * Built once with the verifier and shared read-only by all verification calls.
 *
 * @param bundleId                expected bundle identifier
 * @param appAppleId              expected app identifier, or {@code null} when not checked
 * @param environment             expected deployment environment (Sandbox or Production)
 * @param revocationCheckEnabled  whether chain certificates are checked online over OCSP
 * @param revocationFailurePolicy how an unreachable or inconclusive responder is treated
 * @param clock                   time source for certificate validity windows
 */
public record VerificationContext(
        String bundleId,
        Long appAppleId,
        Environment environment,
        boolean revocationCheckEnabled,
        RevocationFailurePolicy revocationFailurePolicy,
        Clock clock
) {

    public VerificationContext {
        Assert.hasText(bundleId, "bundleId must not be empty");
        Assert.notNull(environment, "environment must not be null");
        Assert.isTrue(environment == Environment.SANDBOX || environment == Environment.PRODUCTION,
                "environment must be Sandbox or Production, got: " + environment);
        Assert.notNull(revocationFailurePolicy, "revocationFailurePolicy must not be null");
        Assert.notNull(clock, "clock must not be null");
    }

}
