package com.example.signeddata.revocation;

/**
 * How a revocation check that cannot reach a verdict is treated. A certificate reported
 * as revoked is rejected under either policy.
 */
public enum RevocationFailurePolicy {

    /** An unreachable responder, a timeout or an inconclusive response rejects the token. */
    FAIL_CLOSED,

    /** An unreachable responder, a timeout or an inconclusive response is logged and tolerated. */
    FAIL_OPEN

}
