package com.example.signeddata;

import java.util.Optional;

/**
 * Thrown when a signed token fails any verification stage.
 * Carries the failure kind, and where relevant the offending chain index and the
 * nested payload field the failure originated from.
 */
public class SignedDataVerificationException extends Exception {

    private final VerificationError error;
    private final Integer certificateIndex;
    private final String field;

    public SignedDataVerificationException(VerificationError error, String message) {
        this(error, message, null, null, null);
    }

    public SignedDataVerificationException(VerificationError error, String message, Throwable cause) {
        this(error, message, null, null, cause);
    }

    private SignedDataVerificationException(VerificationError error, String message, Integer certificateIndex,
                                            String field, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.certificateIndex = certificateIndex;
        this.field = field;
    }

    public static SignedDataVerificationException atCertificate(VerificationError error, int index, String message) {
        return new SignedDataVerificationException(error, message, index, null, null);
    }

    public static SignedDataVerificationException atCertificate(VerificationError error, int index, String message,
                                                                Throwable cause) {
        return new SignedDataVerificationException(error, message, index, null, cause);
    }

    /**
     * Re-attributes this failure to a nested token field of the enclosing payload.
     * Kind and certificate index are preserved.
     */
    public SignedDataVerificationException inField(String nestedField) {
        String qualified = field == null ? nestedField : nestedField + "." + field;
        return new SignedDataVerificationException(error, getMessage(), certificateIndex, qualified, this);
    }

    public VerificationError getError() {
        return error;
    }

    public Optional<Integer> getCertificateIndex() {
        return Optional.ofNullable(certificateIndex);
    }

    public Optional<String> getField() {
        return Optional.ofNullable(field);
    }

}
