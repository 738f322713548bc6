package com.example.signeddata.revocation;

import java.io.IOException;
import java.net.URI;

/**
 * Sends a DER-encoded OCSP request to a responder and returns the DER-encoded response.
 * Implementations block; {@link OcspRevocationChecker} runs them off the caller's thread.
 */
@FunctionalInterface
public interface OcspTransport {

    byte[] send(URI responderUri, byte[] ocspRequest) throws IOException;

}
