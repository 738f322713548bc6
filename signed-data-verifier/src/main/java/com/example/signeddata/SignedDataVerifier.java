package com.example.signeddata;

import com.example.signeddata.chain.CertificateChain;
import com.example.signeddata.chain.ChainValidator;
import com.example.signeddata.chain.TrustedRootSet;
import com.example.signeddata.decode.PayloadDecoder;
import com.example.signeddata.model.AppTransaction;
import com.example.signeddata.model.DecodedPayload;
import com.example.signeddata.model.Environment;
import com.example.signeddata.model.NotificationEnvelope;
import com.example.signeddata.model.PayloadKind;
import com.example.signeddata.model.RenewalInfo;
import com.example.signeddata.model.TransactionInfo;
import com.example.signeddata.revocation.OcspRevocationChecker;
import com.example.signeddata.revocation.OcspTransport;
import com.example.signeddata.revocation.RestTemplateOcspTransport;
import com.example.signeddata.revocation.RevocationFailurePolicy;
import com.example.signeddata.scope.ScopeValidator;
import com.example.signeddata.signature.JwsSignatureVerifier;
import com.example.signeddata.token.CompactToken;
import com.example.signeddata.token.TokenParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Verifies signed platform tokens and decodes their payloads.
 *
 * <p>Every call runs the same sequence: parse the token, validate the embedded certificate
 * chain against the trusted roots, optionally check revocation over OCSP, verify the ES256
 * signature with the leaf key, decode the payload (re-verifying nested tokens from scratch)
 * and finally check bundle id, app id and environment. The first failing stage ends the call.
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
public class SignedDataVerifier {

    private static final Logger logger = LoggerFactory.getLogger(SignedDataVerifier.class);

    private final VerificationContext context;
    private final TokenParser tokenParser;
    private final ChainValidator chainValidator;
    private final OcspRevocationChecker revocationChecker;
    private final JwsSignatureVerifier signatureVerifier;
    private final PayloadDecoder payloadDecoder;
    private final ScopeValidator scopeValidator;

    /**
     * @param rootCertificates      DER encoded trusted root certificates
     * @param environment           expected environment, Sandbox or Production
     * @param bundleId              expected bundle identifier
     * @param appAppleId            expected app apple id, or {@code null}
     * @param enableRevocationCheck whether chain certificates are checked over OCSP
     * @throws SignedDataVerificationException with {@link VerificationError#INVALID_ROOT_CERTIFICATE}
     *                                         if a root certificate cannot be parsed
     */
    public SignedDataVerifier(List<byte[]> rootCertificates, Environment environment, String bundleId,
                              Long appAppleId, boolean enableRevocationCheck) throws SignedDataVerificationException {
        this(builder()
                .rootCertificates(rootCertificates)
                .environment(environment)
                .bundleId(bundleId)
                .appAppleId(appAppleId)
                .revocationCheckEnabled(enableRevocationCheck));
    }

    private SignedDataVerifier(Builder builder) throws SignedDataVerificationException {
        this.context = new VerificationContext(builder.bundleId, builder.appAppleId, builder.environment,
                builder.revocationCheckEnabled, builder.revocationFailurePolicy, builder.clock);
        TrustedRootSet trustedRoots = TrustedRootSet.of(builder.rootCertificates);

        this.tokenParser = new TokenParser();
        this.chainValidator = new ChainValidator(trustedRoots, builder.maxChainLength, builder.requirePlatformMarkers);
        this.revocationChecker = builder.revocationCheckEnabled ? builder.buildRevocationChecker() : null;
        this.signatureVerifier = new JwsSignatureVerifier();
        this.payloadDecoder = new PayloadDecoder(builder.objectMapper);
        this.scopeValidator = new ScopeValidator();

        logger.info("Signed data verifier ready: environment={}, bundleId={}, roots={}, revocationCheck={}",
                context.environment().value(), context.bundleId(), trustedRoots.size(),
                context.revocationCheckEnabled() ? context.revocationFailurePolicy() : "disabled");
    }

    public static Builder builder() {
        return new Builder();
    }

    public NotificationEnvelope verifyAndDecodeNotification(String token) throws SignedDataVerificationException {
        return verifyAndDecode(token, PayloadKind.NOTIFICATION, NotificationEnvelope.class);
    }

    public TransactionInfo verifyAndDecodeTransaction(String token) throws SignedDataVerificationException {
        return verifyAndDecode(token, PayloadKind.TRANSACTION, TransactionInfo.class);
    }

    public RenewalInfo verifyAndDecodeRenewalInfo(String token) throws SignedDataVerificationException {
        return verifyAndDecode(token, PayloadKind.RENEWAL_INFO, RenewalInfo.class);
    }

    public AppTransaction verifyAndDecodeAppTransaction(String token) throws SignedDataVerificationException {
        return verifyAndDecode(token, PayloadKind.APP_TRANSACTION, AppTransaction.class);
    }

    /**
     * Verifies a token of any shape. Payloads matching no known variant are returned as
     * {@link com.example.signeddata.model.UnknownPayload}.
     */
    public DecodedPayload verifyAndDecode(String token) throws SignedDataVerificationException {
        return verifyAndDecode(token, null, DecodedPayload.class);
    }

    public VerificationContext getContext() {
        return context;
    }

    private <T extends DecodedPayload> T verifyAndDecode(String token, PayloadKind expectedKind, Class<T> type)
            throws SignedDataVerificationException {
        try {
            return type.cast(verify(token, expectedKind));
        } catch (SignedDataVerificationException e) {
            logger.warn("❌ {} verification failed: {} (index={}, field={}): {}",
                    expectedKind == null ? "Payload" : expectedKind, e.getError(),
                    e.getCertificateIndex().orElse(null), e.getField().orElse(null), e.getMessage());
            throw e;
        }
    }

    private DecodedPayload verify(String token, PayloadKind expectedKind) throws SignedDataVerificationException {
        // Step 1: Split the token and read its header
        CompactToken compactToken = tokenParser.parse(token);

        // Step 2: Validate the embedded chain against the trusted roots
        CertificateChain chain = chainValidator.validate(compactToken.certificateChain(), context.clock().instant());

        // Step 3: Revocation, only for a trusted chain
        if (revocationChecker != null) {
            revocationChecker.check(chain);
        }

        // Step 4: Signature over the transmitted header and payload segments
        signatureVerifier.verify(compactToken, chain.leaf().getPublicKey());

        // Step 5: Decode, re-entering this pipeline for nested tokens
        DecodedPayload payload = payloadDecoder.decode(compactToken, expectedKind, this::verify);

        // Step 6: Bundle id, app id and environment
        scopeValidator.validate(payload, context);
        return payload;
    }

    public static final class Builder {

        private List<byte[]> rootCertificates;
        private Environment environment;
        private String bundleId;
        private Long appAppleId;
        private boolean revocationCheckEnabled;
        private RevocationFailurePolicy revocationFailurePolicy = RevocationFailurePolicy.FAIL_CLOSED;
        private OcspTransport ocspTransport;
        private Duration revocationTimeout = OcspRevocationChecker.DEFAULT_TIMEOUT;
        private Executor revocationExecutor;
        private Clock clock = Clock.systemUTC();
        private int maxChainLength = ChainValidator.DEFAULT_MAX_CHAIN_LENGTH;
        private boolean requirePlatformMarkers;
        private ObjectMapper objectMapper = new ObjectMapper();

        private Builder() {
        }

        public Builder rootCertificates(List<byte[]> rootCertificates) {
            this.rootCertificates = rootCertificates;
            return this;
        }

        public Builder environment(Environment environment) {
            this.environment = environment;
            return this;
        }

        public Builder bundleId(String bundleId) {
            this.bundleId = bundleId;
            return this;
        }

        public Builder appAppleId(Long appAppleId) {
            this.appAppleId = appAppleId;
            return this;
        }

        public Builder revocationCheckEnabled(boolean revocationCheckEnabled) {
            this.revocationCheckEnabled = revocationCheckEnabled;
            return this;
        }

        public Builder revocationFailurePolicy(RevocationFailurePolicy revocationFailurePolicy) {
            this.revocationFailurePolicy = revocationFailurePolicy;
            return this;
        }

        public Builder ocspTransport(OcspTransport ocspTransport) {
            this.ocspTransport = ocspTransport;
            return this;
        }

        public Builder revocationTimeout(Duration revocationTimeout) {
            this.revocationTimeout = revocationTimeout;
            return this;
        }

        /**
         * Executor the blocking OCSP exchanges run on. Defaults to a fixed pool of
         * {@link OcspRevocationChecker#DEFAULT_POOL_SIZE} daemon threads owned by this verifier;
         * applications creating many verifiers should share one executor instead.
         */
        public Builder revocationExecutor(Executor revocationExecutor) {
            this.revocationExecutor = revocationExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder maxChainLength(int maxChainLength) {
            this.maxChainLength = maxChainLength;
            return this;
        }

        public Builder requirePlatformMarkers(boolean requirePlatformMarkers) {
            this.requirePlatformMarkers = requirePlatformMarkers;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public SignedDataVerifier build() throws SignedDataVerificationException {
            return new SignedDataVerifier(this);
        }

        private OcspRevocationChecker buildRevocationChecker() {
            OcspTransport transport = ocspTransport != null ? ocspTransport : new RestTemplateOcspTransport(revocationTimeout);
            Executor executor = revocationExecutor != null ? revocationExecutor : defaultRevocationExecutor();
            return new OcspRevocationChecker(transport, executor, revocationTimeout, revocationFailurePolicy, clock);
        }

        static ExecutorService defaultRevocationExecutor() {
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("ocsp-");
            threadFactory.setDaemon(true);
            return Executors.newFixedThreadPool(OcspRevocationChecker.DEFAULT_POOL_SIZE, threadFactory);
        }

    }

}
