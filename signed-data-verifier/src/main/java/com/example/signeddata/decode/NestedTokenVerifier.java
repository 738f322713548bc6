package com.example.signeddata.decode;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.model.DecodedPayload;
import com.example.signeddata.model.PayloadKind;

/**
 * Runs the complete verification pipeline on a token embedded in a verified payload.
 */
@FunctionalInterface
public interface NestedTokenVerifier {

    DecodedPayload verify(String token, PayloadKind expectedKind) throws SignedDataVerificationException;

}
