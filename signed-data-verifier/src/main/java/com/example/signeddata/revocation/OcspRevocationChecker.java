package com.example.signeddata.revocation;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.VerificationError;
import com.example.signeddata.chain.CertificateChain;
import org.bouncycastle.asn1.ASN1IA5String;
import org.bouncycastle.asn1.x509.AccessDescription;
import org.bouncycastle.asn1.x509.AuthorityInformationAccess;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.cert.CertException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.ocsp.BasicOCSPResp;
import org.bouncycastle.cert.ocsp.CertificateID;
import org.bouncycastle.cert.ocsp.CertificateStatus;
import org.bouncycastle.cert.ocsp.OCSPException;
import org.bouncycastle.cert.ocsp.OCSPReq;
import org.bouncycastle.cert.ocsp.OCSPReqBuilder;
import org.bouncycastle.cert.ocsp.OCSPResp;
import org.bouncycastle.cert.ocsp.RevokedStatus;
import org.bouncycastle.cert.ocsp.SingleResp;
import org.bouncycastle.operator.ContentVerifierProvider;
import org.bouncycastle.operator.DigestCalculatorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Checks every non-root certificate of a validated chain against the OCSP responder
 * advertised in its Authority Information Access extension.
 *
 * <p>Each request is dispatched on the given executor and bounded by the timeout, so a
 * stalled responder resolves to {@link VerificationError#REVOCATION_CHECK_FAILED}.
 */
public class OcspRevocationChecker {

    private static final Logger logger = LoggerFactory.getLogger(OcspRevocationChecker.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public static final int DEFAULT_POOL_SIZE = 8;

    private final OcspTransport transport;
    private final Executor executor;
    private final Duration timeout;
    private final RevocationFailurePolicy failurePolicy;
    private final Clock clock;
    private final DigestCalculatorProvider digestProvider;

    public OcspRevocationChecker(OcspTransport transport, Executor executor, Duration timeout,
                                 RevocationFailurePolicy failurePolicy, Clock clock) {
        Assert.notNull(transport, "transport must not be null");
        Assert.notNull(executor, "executor must not be null");
        Assert.isTrue(timeout != null && !timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
        Assert.notNull(failurePolicy, "failurePolicy must not be null");
        Assert.notNull(clock, "clock must not be null");
        this.transport = transport;
        this.executor = executor;
        this.timeout = timeout;
        this.failurePolicy = failurePolicy;
        this.clock = clock;
        try {
            this.digestProvider = new JcaDigestCalculatorProviderBuilder().build();
        } catch (OperatorCreationException e) {
            throw new IllegalStateException("Digest calculator provider unavailable", e);
        }
    }

    public void check(CertificateChain chain) throws SignedDataVerificationException {
        for (int i = 0; i < chain.length(); i++) {
            if (chain.isTrustAnchor(i)) {
                continue;
            }
            try {
                checkCertificate(chain.certificates().get(i), chain.issuerOf(i), i);
            } catch (SignedDataVerificationException e) {
                if (e.getError() == VerificationError.REVOCATION_CHECK_FAILED
                        && failurePolicy == RevocationFailurePolicy.FAIL_OPEN) {
                    logger.warn("⚠️ Revocation status of certificate {} unavailable, continuing (fail-open): {}",
                            i, e.getMessage());
                    continue;
                }
                throw e;
            }
        }
    }

    private void checkCertificate(X509Certificate certificate, X509Certificate issuer, int index)
            throws SignedDataVerificationException {

        URI responder = responderUri(certificate, index);

        // Step 1: Build the request for this certificate, identified through its issuer
        X509CertificateHolder issuerHolder;
        CertificateID certId;
        byte[] requestBytes;
        try {
            issuerHolder = new JcaX509CertificateHolder(issuer);
            certId = new CertificateID(digestProvider.get(CertificateID.HASH_SHA1), issuerHolder,
                    certificate.getSerialNumber());
            OCSPReq request = new OCSPReqBuilder().addRequest(certId).build();
            requestBytes = request.getEncoded();
        } catch (CertificateException | OperatorCreationException | OCSPException | IOException e) {
            throw failed(index, "Could not build OCSP request: " + e.getMessage(), e);
        }

        // Step 2: Exchange it with the responder off the calling thread
        byte[] responseBytes = exchange(responder, requestBytes, index);

        // Step 3: Parse, authenticate and match the response
        BasicOCSPResp basicResponse = parseResponse(responseBytes, index);
        verifyResponseSignature(basicResponse, issuerHolder, index);
        SingleResp singleResponse = findResponse(basicResponse, certId, issuerHolder, index);

        // Step 4: Evaluate the status
        Date now = Date.from(clock.instant());
        if (singleResponse.getNextUpdate() != null && singleResponse.getNextUpdate().before(now)) {
            throw failed(index, "OCSP response for certificate " + index + " is stale (nextUpdate "
                    + singleResponse.getNextUpdate().toInstant() + ")", null);
        }

        CertificateStatus status = singleResponse.getCertStatus();
        if (status == CertificateStatus.GOOD) {
            logger.debug("OCSP status good for certificate {} (serial {})", index, certificate.getSerialNumber());
            return;
        }
        if (status instanceof RevokedStatus revoked) {
            logger.warn("⛔ Certificate {} (serial {}) is revoked", index, certificate.getSerialNumber());
            throw SignedDataVerificationException.atCertificate(VerificationError.CERTIFICATE_REVOKED, index,
                    "Certificate " + index + " was revoked at " + revoked.getRevocationTime().toInstant());
        }
        throw failed(index, "OCSP responder reports unknown status for certificate " + index, null);
    }

    private URI responderUri(X509Certificate certificate, int index) throws SignedDataVerificationException {
        byte[] aiaValue = certificate.getExtensionValue(Extension.authorityInfoAccess.getId());
        if (aiaValue == null) {
            throw failed(index, "Certificate " + index + " has no Authority Information Access extension", null);
        }
        try {
            AuthorityInformationAccess aia = AuthorityInformationAccess.getInstance(
                    JcaX509ExtensionUtils.parseExtensionValue(aiaValue));
            for (AccessDescription description : aia.getAccessDescriptions()) {
                GeneralName location = description.getAccessLocation();
                if (AccessDescription.id_ad_ocsp.equals(description.getAccessMethod())
                        && location.getTagNo() == GeneralName.uniformResourceIdentifier) {
                    return URI.create(ASN1IA5String.getInstance(location.getName()).getString());
                }
            }
        } catch (IOException | RuntimeException e) {
            throw failed(index, "Certificate " + index + " has a malformed Authority Information Access extension", e);
        }
        throw failed(index, "Certificate " + index + " advertises no OCSP responder", null);
    }

    private byte[] exchange(URI responder, byte[] requestBytes, int index) throws SignedDataVerificationException {
        CompletableFuture<byte[]> response = CompletableFuture.supplyAsync(() -> {
            try {
                return transport.send(responder, requestBytes);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor);

        try {
            return response.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            response.cancel(true);
            throw failed(index, "OCSP responder " + responder + " did not answer within " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof UncheckedIOException unchecked ? unchecked.getCause() : e.getCause();
            throw failed(index, "OCSP request to " + responder + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failed(index, "Interrupted while waiting for OCSP responder " + responder, e);
        }
    }

    private BasicOCSPResp parseResponse(byte[] responseBytes, int index) throws SignedDataVerificationException {
        try {
            OCSPResp response = new OCSPResp(responseBytes);
            if (response.getStatus() != OCSPResp.SUCCESSFUL) {
                throw failed(index, "OCSP responder returned status " + response.getStatus(), null);
            }
            if (response.getResponseObject() instanceof BasicOCSPResp basicResponse) {
                return basicResponse;
            }
            throw failed(index, "OCSP response is not a basic response", null);
        } catch (IOException | OCSPException | RuntimeException e) {
            throw failed(index, "Malformed OCSP response", e);
        }
    }

    private void verifyResponseSignature(BasicOCSPResp response, X509CertificateHolder issuer, int index)
            throws SignedDataVerificationException {
        try {
            ContentVerifierProvider issuerVerifier = new JcaContentVerifierProviderBuilder().build(issuer);
            if (response.isSignatureValid(issuerVerifier)) {
                return;
            }

            // Delegated responder: issued by the same CA for OCSP signing
            Date now = Date.from(clock.instant());
            for (X509CertificateHolder responderCert : response.getCerts()) {
                if (!responderCert.getIssuer().equals(issuer.getSubject())
                        || !responderCert.isValidOn(now)
                        || !isOcspSigner(responderCert)
                        || !responderCert.isSignatureValid(issuerVerifier)) {
                    continue;
                }
                if (response.isSignatureValid(new JcaContentVerifierProviderBuilder().build(responderCert))) {
                    return;
                }
            }
        } catch (OperatorCreationException | CertificateException | OCSPException | CertException e) {
            throw failed(index, "OCSP response signature could not be verified", e);
        }
        throw failed(index, "OCSP response is not signed by the issuer of certificate " + index
                + " or an authorized responder", null);
    }

    private boolean isOcspSigner(X509CertificateHolder responderCert) {
        if (responderCert.getExtensions() == null) {
            return false;
        }
        ExtendedKeyUsage usage = ExtendedKeyUsage.fromExtensions(responderCert.getExtensions());
        return usage != null && usage.hasKeyPurposeId(KeyPurposeId.id_kp_OCSPSigning);
    }

    private SingleResp findResponse(BasicOCSPResp response, CertificateID requested, X509CertificateHolder issuer,
                                    int index) throws SignedDataVerificationException {
        try {
            for (SingleResp single : response.getResponses()) {
                CertificateID id = single.getCertID();
                if (id.getSerialNumber().equals(requested.getSerialNumber())
                        && id.matchesIssuer(issuer, digestProvider)) {
                    return single;
                }
            }
        } catch (OCSPException e) {
            throw failed(index, "OCSP response could not be matched to the request", e);
        }
        throw failed(index, "OCSP response carries no status for certificate " + index, null);
    }

    private static SignedDataVerificationException failed(int index, String message, Throwable cause) {
        return SignedDataVerificationException.atCertificate(VerificationError.REVOCATION_CHECK_FAILED, index,
                message, cause);
    }

}
