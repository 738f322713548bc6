package com.example.signeddata.chain;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.VerificationError;
import com.nimbusds.jose.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import java.io.ByteArrayInputStream;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Builds the embedded certificate chain and validates it against the trusted roots:
 * length bound, encoding, issuer linkage, trust anchor membership and validity windows.
 */
public class ChainValidator {

    private static final Logger logger = LoggerFactory.getLogger(ChainValidator.class);

    public static final int DEFAULT_MAX_CHAIN_LENGTH = 5;

    /** Marker extension carried by the platform's receipt-signing leaf certificates. */
    public static final String LEAF_MARKER_OID = "1.2.840.113635.100.6.11.1";

    /** Marker extension carried by the platform's intermediate certificate authority. */
    public static final String INTERMEDIATE_MARKER_OID = "1.2.840.113635.100.6.2.1";

    private final TrustedRootSet trustedRoots;
    private final int maxChainLength;
    private final List<String> requiredExtensions;

    public ChainValidator(TrustedRootSet trustedRoots, int maxChainLength, boolean requirePlatformMarkers) {
        Assert.notNull(trustedRoots, "trustedRoots must not be null");
        Assert.isTrue(maxChainLength > 0, "maxChainLength must be positive, got: " + maxChainLength);
        this.trustedRoots = trustedRoots;
        this.maxChainLength = maxChainLength;
        this.requiredExtensions = requirePlatformMarkers
                ? List.of(LEAF_MARKER_OID, INTERMEDIATE_MARKER_OID)
                : List.of();
    }

    public CertificateChain validate(List<Base64> encodedChain, Instant verificationTime)
            throws SignedDataVerificationException {

        if (encodedChain == null || encodedChain.isEmpty()) {
            throw new SignedDataVerificationException(VerificationError.MISSING_CERTIFICATE_CHAIN,
                    "Certificate chain is empty");
        }
        if (encodedChain.size() > maxChainLength) {
            throw new SignedDataVerificationException(VerificationError.CHAIN_TOO_LONG,
                    "Certificate chain has " + encodedChain.size() + " entries, at most " + maxChainLength
                            + " are accepted");
        }

        // Step 1: Parse every certificate
        List<X509Certificate> certificates = parseCertificates(encodedChain);

        // Step 2: Each certificate must be issued and signed by the next one
        for (int i = 0; i < certificates.size() - 1; i++) {
            verifyLink(certificates.get(i), certificates.get(i + 1), i);
        }

        // Step 3: The last certificate must be, or be signed by, a trusted root
        X509Certificate last = certificates.get(certificates.size() - 1);
        Optional<X509Certificate> anchor = trustedRoots.anchorFor(last);
        if (anchor.isEmpty()) {
            throw new SignedDataVerificationException(VerificationError.UNTRUSTED_ROOT,
                    "Certificate chain does not terminate at a trusted root (last issuer: "
                            + last.getIssuerX500Principal() + ")");
        }
        CertificateChain chain = new CertificateChain(certificates, anchor.get());

        // Step 4: Every certificate, including an anchor outside the chain, must be valid now
        checkValidity(chain, verificationTime);

        // Step 5: Platform marker extensions, when enforced
        checkRequiredExtensions(certificates);

        logger.debug("Certificate chain of {} certificate(s) validated against root {}",
                certificates.size(), anchor.get().getSubjectX500Principal());
        return chain;
    }

    private List<X509Certificate> parseCertificates(List<Base64> encodedChain) throws SignedDataVerificationException {
        CertificateFactory certFactory;
        try {
            certFactory = CertificateFactory.getInstance("X.509");
        } catch (CertificateException e) {
            throw new IllegalStateException("X.509 certificate factory unavailable", e);
        }

        List<X509Certificate> certificates = new ArrayList<>(encodedChain.size());
        for (int i = 0; i < encodedChain.size(); i++) {
            try {
                byte[] certBytes = encodedChain.get(i).decode();
                if (certBytes.length == 0) {
                    throw new CertificateException("Empty certificate");
                }
                certificates.add((X509Certificate) certFactory.generateCertificate(
                        new ByteArrayInputStream(certBytes)));
            } catch (CertificateException | RuntimeException e) {
                throw SignedDataVerificationException.atCertificate(VerificationError.INVALID_CERTIFICATE_ENCODING,
                        i, "Certificate " + i + " is not a valid X.509 certificate", e);
            }
        }
        return certificates;
    }

    private void verifyLink(X509Certificate subject, X509Certificate issuer, int index)
            throws SignedDataVerificationException {

        if (!subject.getIssuerX500Principal().equals(issuer.getSubjectX500Principal())) {
            throw SignedDataVerificationException.atCertificate(VerificationError.BROKEN_CHAIN_LINK, index,
                    "Issuer of certificate " + index + " does not match the subject of certificate " + (index + 1));
        }
        if (issuer.getBasicConstraints() < 0) {
            throw SignedDataVerificationException.atCertificate(VerificationError.BROKEN_CHAIN_LINK, index,
                    "Certificate " + (index + 1) + " is not a certificate authority");
        }
        try {
            subject.verify(issuer.getPublicKey());
        } catch (GeneralSecurityException e) {
            throw SignedDataVerificationException.atCertificate(VerificationError.BROKEN_CHAIN_LINK, index,
                    "Certificate " + index + " is not signed by certificate " + (index + 1), e);
        }
    }

    private void checkValidity(CertificateChain chain, Instant verificationTime)
            throws SignedDataVerificationException {

        Date at = Date.from(verificationTime);
        for (int i = 0; i < chain.length(); i++) {
            checkValidity(chain.certificates().get(i), i, at);
        }
        if (!chain.isTrustAnchor(chain.length() - 1)) {
            checkValidity(chain.trustAnchor(), chain.length(), at);
        }
    }

    private void checkValidity(X509Certificate certificate, int index, Date at)
            throws SignedDataVerificationException {
        try {
            certificate.checkValidity(at);
        } catch (CertificateExpiredException e) {
            throw SignedDataVerificationException.atCertificate(VerificationError.CERTIFICATE_EXPIRED, index,
                    "Certificate " + index + " expired at " + certificate.getNotAfter().toInstant(), e);
        } catch (CertificateNotYetValidException e) {
            throw SignedDataVerificationException.atCertificate(VerificationError.CERTIFICATE_NOT_YET_VALID, index,
                    "Certificate " + index + " is not valid before " + certificate.getNotBefore().toInstant(), e);
        }
    }

    private void checkRequiredExtensions(List<X509Certificate> certificates) throws SignedDataVerificationException {
        // requiredExtensions.get(i) must be present on certificate i
        for (int index = 0; index < requiredExtensions.size(); index++) {
            String oid = requiredExtensions.get(index);
            if (index >= certificates.size() || certificates.get(index).getExtensionValue(oid) == null) {
                throw SignedDataVerificationException.atCertificate(VerificationError.MISSING_REQUIRED_EXTENSION,
                        index, "Certificate " + index + " lacks required extension " + oid);
            }
        }
    }

}
