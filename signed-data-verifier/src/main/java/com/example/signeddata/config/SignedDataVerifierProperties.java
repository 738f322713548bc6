package com.example.signeddata.config;

import com.example.signeddata.model.Environment;
import com.example.signeddata.revocation.OcspRevocationChecker;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the signed data verifier.
 * Roots, expected app scope and the optional OCSP revocation check.
 */
@ConfigurationProperties(prefix = "app.signed-data")
public class SignedDataVerifierProperties {

    /**
     * Trusted root certificates, DER or PEM encoded (e.g. classpath:certs/root.cer).
     */
    private List<Resource> rootCertificates = new ArrayList<>();

    /**
     * Expected environment: Sandbox or Production.
     */
    private Environment environment = Environment.PRODUCTION;

    /**
     * Expected bundle identifier. The verifier is only auto-configured when this is set.
     */
    private String bundleId;

    /**
     * Expected app apple id; not checked when unset.
     */
    private Long appAppleId;

    /**
     * Maximum number of certificates accepted in a token's x5c chain.
     */
    private int maxChainLength = 5;

    /**
     * Require the platform's marker extensions on the leaf and intermediate certificates.
     */
    private boolean requirePlatformMarkers;

    /**
     * Threads running verifications for the asynchronous verifier.
     */
    private int verificationPoolSize = 4;

    private final Revocation revocation = new Revocation();

    public List<Resource> getRootCertificates() {
        return rootCertificates;
    }

    public void setRootCertificates(List<Resource> rootCertificates) {
        this.rootCertificates = rootCertificates;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    public String getBundleId() {
        return bundleId;
    }

    public void setBundleId(String bundleId) {
        this.bundleId = bundleId;
    }

    public Long getAppAppleId() {
        return appAppleId;
    }

    public void setAppAppleId(Long appAppleId) {
        this.appAppleId = appAppleId;
    }

    public int getMaxChainLength() {
        return maxChainLength;
    }

    public void setMaxChainLength(int maxChainLength) {
        this.maxChainLength = maxChainLength;
    }

    public boolean isRequirePlatformMarkers() {
        return requirePlatformMarkers;
    }

    public void setRequirePlatformMarkers(boolean requirePlatformMarkers) {
        this.requirePlatformMarkers = requirePlatformMarkers;
    }

    public int getVerificationPoolSize() {
        return verificationPoolSize;
    }

    public void setVerificationPoolSize(int verificationPoolSize) {
        this.verificationPoolSize = verificationPoolSize;
    }

    public Revocation getRevocation() {
        return revocation;
    }

    public static class Revocation {

        /**
         * Check every non-root chain certificate against its OCSP responder.
         */
        private boolean enabled;

        /**
         * Accept tokens whose revocation status could not be determined. Revoked certificates are always rejected.
         */
        private boolean failOpen;

        /**
         * Upper bound for a single OCSP exchange.
         */
        private Duration timeout = Duration.ofSeconds(5);

        /**
         * Threads available for concurrent OCSP exchanges.
         */
        private int poolSize = OcspRevocationChecker.DEFAULT_POOL_SIZE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

    }

}
