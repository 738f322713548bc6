package com.example.signeddata.chain;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.VerificationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Immutable set of caller-supplied root certificates a chain must terminate at.
 */
public final class TrustedRootSet {

    private static final Logger logger = LoggerFactory.getLogger(TrustedRootSet.class);

    private final List<X509Certificate> roots;

    private TrustedRootSet(List<X509Certificate> roots) {
        this.roots = List.copyOf(roots);
    }

    /**
     * Parses DER (or PEM) encoded root certificates.
     *
     * @throws SignedDataVerificationException with {@link VerificationError#INVALID_ROOT_CERTIFICATE}
     *                                         if the collection is empty or any entry fails to parse
     */
    public static TrustedRootSet of(Collection<byte[]> encodedRoots) throws SignedDataVerificationException {
        if (encodedRoots == null || encodedRoots.isEmpty()) {
            throw new SignedDataVerificationException(VerificationError.INVALID_ROOT_CERTIFICATE,
                    "At least one root certificate is required");
        }

        List<X509Certificate> parsed = new ArrayList<>(encodedRoots.size());
        int index = 0;
        for (byte[] encoded : encodedRoots) {
            try {
                parsed.add(parse(encoded));
            } catch (CertificateException | RuntimeException e) {
                throw SignedDataVerificationException.atCertificate(VerificationError.INVALID_ROOT_CERTIFICATE, index,
                        "Root certificate " + index + " could not be parsed", e);
            }
            index++;
        }

        for (X509Certificate root : parsed) {
            logger.debug("Loaded trusted root: {}", root.getSubjectX500Principal());
        }
        return new TrustedRootSet(parsed);
    }

    private static X509Certificate parse(byte[] encoded) throws CertificateException {
        if (encoded == null || encoded.length == 0) {
            throw new CertificateException("Empty certificate");
        }
        CertificateFactory certFactory = CertificateFactory.getInstance("X.509");
        return (X509Certificate) certFactory.generateCertificate(new ByteArrayInputStream(encoded));
    }

    /**
     * Finds the root that anchors {@code certificate}: either a root identical to it, or a
     * root whose subject is the certificate's issuer and whose key verifies its signature.
     */
    public Optional<X509Certificate> anchorFor(X509Certificate certificate) {
        byte[] encoded;
        try {
            encoded = certificate.getEncoded();
        } catch (CertificateException e) {
            return Optional.empty();
        }

        for (X509Certificate root : roots) {
            try {
                if (Arrays.equals(root.getEncoded(), encoded)) {
                    return Optional.of(root);
                }
            } catch (CertificateException e) {
                logger.debug("Skipping root that cannot be re-encoded: {}", e.getMessage());
            }
        }

        for (X509Certificate root : roots) {
            if (!root.getSubjectX500Principal().equals(certificate.getIssuerX500Principal())) {
                continue;
            }
            try {
                certificate.verify(root.getPublicKey());
                return Optional.of(root);
            } catch (GeneralSecurityException e) {
                logger.debug("Root {} does not verify {}: {}", root.getSubjectX500Principal(),
                        certificate.getSubjectX500Principal(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    public int size() {
        return roots.size();
    }

    List<X509Certificate> certificates() {
        return roots;
    }

}
