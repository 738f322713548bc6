package com.example.signeddata.chain;

import java.security.cert.X509Certificate;
import java.util.List;

/**
 * A validated, leaf-first certificate chain together with the trusted root it terminates at.
 * The anchor may itself be the last element of {@code certificates}.
 */
public record CertificateChain(List<X509Certificate> certificates, X509Certificate trustAnchor) {

    public CertificateChain {
        certificates = List.copyOf(certificates);
    }

    public X509Certificate leaf() {
        return certificates.get(0);
    }

    public int length() {
        return certificates.size();
    }

    /**
     * The certificate that issued the chain element at {@code index}.
     */
    public X509Certificate issuerOf(int index) {
        return index + 1 < certificates.size() ? certificates.get(index + 1) : trustAnchor;
    }

    public boolean isTrustAnchor(int index) {
        return certificates.get(index).equals(trustAnchor);
    }

}
