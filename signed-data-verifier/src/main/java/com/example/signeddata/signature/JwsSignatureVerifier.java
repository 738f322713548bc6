package com.example.signeddata.signature;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.VerificationError;
import com.example.signeddata.token.CompactToken;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.util.Base64URL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;

/**
 * Verifies the token signature with the leaf certificate's key. Only ES256 is accepted;
 * the declared algorithm never selects a key type or a verification routine.
 */
public class JwsSignatureVerifier {

    private static final Logger logger = LoggerFactory.getLogger(JwsSignatureVerifier.class);

    public void verify(CompactToken token, PublicKey leafKey) throws SignedDataVerificationException {
        if (token.header() == null || !JWSAlgorithm.ES256.equals(token.header().getAlgorithm())) {
            throw new SignedDataVerificationException(VerificationError.UNSUPPORTED_ALGORITHM,
                    "Unsupported signature algorithm: " + token.algorithm());
        }
        if (!(leafKey instanceof ECPublicKey ecKey)) {
            throw new SignedDataVerificationException(VerificationError.INVALID_SIGNATURE,
                    "Leaf certificate key is not an EC key");
        }

        // unused trailing bits must be zero, otherwise distinct segments decode to one signature
        Base64URL signature = token.signatureSegment();
        if (!Base64URL.encode(signature.decode()).toString().equals(signature.toString())) {
            throw new SignedDataVerificationException(VerificationError.INVALID_SIGNATURE,
                    "Signature segment is not canonically base64url encoded");
        }

        boolean valid;
        try {
            valid = new ECDSAVerifier(ecKey).verify(token.header(), token.signingInput(), signature);
        } catch (JOSEException e) {
            throw new SignedDataVerificationException(VerificationError.INVALID_SIGNATURE,
                    "Signature could not be verified: " + e.getMessage(), e);
        }
        if (!valid) {
            throw new SignedDataVerificationException(VerificationError.INVALID_SIGNATURE,
                    "Token signature does not match the leaf certificate key");
        }
        logger.debug("ES256 signature verified");
    }

}
