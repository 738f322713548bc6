package com.example.signeddata;

/**
 * Failure kinds reported by {@link SignedDataVerifier}.
 * Every kind belongs to a {@link Category} so callers can tell a misconfigured
 * bundle id apart from a forged or tampered token.
 */
public enum VerificationError {

    MALFORMED_TOKEN(Category.STRUCTURAL),
    MALFORMED_PAYLOAD(Category.STRUCTURAL),
    INVALID_CERTIFICATE_ENCODING(Category.STRUCTURAL),
    MISSING_CERTIFICATE_CHAIN(Category.STRUCTURAL),

    BROKEN_CHAIN_LINK(Category.TRUST_CHAIN),
    UNTRUSTED_ROOT(Category.TRUST_CHAIN),
    CHAIN_TOO_LONG(Category.TRUST_CHAIN),
    CERTIFICATE_EXPIRED(Category.TRUST_CHAIN),
    CERTIFICATE_NOT_YET_VALID(Category.TRUST_CHAIN),
    MISSING_REQUIRED_EXTENSION(Category.TRUST_CHAIN),

    CERTIFICATE_REVOKED(Category.REVOCATION),
    REVOCATION_CHECK_FAILED(Category.REVOCATION),

    UNSUPPORTED_ALGORITHM(Category.CRYPTOGRAPHIC),
    INVALID_SIGNATURE(Category.CRYPTOGRAPHIC),

    INVALID_BUNDLE_ID(Category.SCOPE),
    INVALID_APP_IDENTIFIER(Category.SCOPE),
    INVALID_ENVIRONMENT(Category.SCOPE),

    INVALID_ROOT_CERTIFICATE(Category.CONFIGURATION);

    public enum Category {
        STRUCTURAL,
        TRUST_CHAIN,
        REVOCATION,
        CRYPTOGRAPHIC,
        SCOPE,
        CONFIGURATION
    }

    private final Category category;

    VerificationError(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

}
