package com.example.signeddata.config;

import com.example.signeddata.AsyncSignedDataVerifier;
import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.SignedDataVerifier;
import com.example.signeddata.revocation.OcspTransport;
import com.example.signeddata.revocation.RestTemplateOcspTransport;
import com.example.signeddata.revocation.RevocationFailurePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.Resource;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Registers a {@link SignedDataVerifier} built from {@code app.signed-data.*} properties,
 * together with its asynchronous variant and the HTTP OCSP transport.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "app.signed-data", name = "bundle-id")
@EnableConfigurationProperties(SignedDataVerifierProperties.class)
public class SignedDataVerifierAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(SignedDataVerifierAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public OcspTransport ocspTransport(SignedDataVerifierProperties properties) {
        return new RestTemplateOcspTransport(properties.getRevocation().getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(name = "signedDataOcspExecutor")
    public ThreadPoolTaskExecutor signedDataOcspExecutor(SignedDataVerifierProperties properties) {
        return threadPool("signed-data-ocsp-", properties.getRevocation().getPoolSize());
    }

    @Bean
    @ConditionalOnMissingBean(name = "signedDataVerificationExecutor")
    public ThreadPoolTaskExecutor signedDataVerificationExecutor(SignedDataVerifierProperties properties) {
        return threadPool("signed-data-verify-", properties.getVerificationPoolSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public SignedDataVerifier signedDataVerifier(SignedDataVerifierProperties properties,
                                                 OcspTransport ocspTransport,
                                                 @Qualifier("signedDataOcspExecutor") Executor ocspExecutor,
                                                 ObjectProvider<Clock> clock)
            throws IOException, SignedDataVerificationException {

        SignedDataVerifierProperties.Revocation revocation = properties.getRevocation();
        return SignedDataVerifier.builder()
                .rootCertificates(readRootCertificates(properties.getRootCertificates()))
                .environment(properties.getEnvironment())
                .bundleId(properties.getBundleId())
                .appAppleId(properties.getAppAppleId())
                .maxChainLength(properties.getMaxChainLength())
                .requirePlatformMarkers(properties.isRequirePlatformMarkers())
                .revocationCheckEnabled(revocation.isEnabled())
                .revocationFailurePolicy(revocation.isFailOpen()
                        ? RevocationFailurePolicy.FAIL_OPEN
                        : RevocationFailurePolicy.FAIL_CLOSED)
                .revocationTimeout(revocation.getTimeout())
                .ocspTransport(ocspTransport)
                .revocationExecutor(ocspExecutor)
                .clock(clock.getIfAvailable(Clock::systemUTC))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public AsyncSignedDataVerifier asyncSignedDataVerifier(SignedDataVerifier signedDataVerifier,
                                                           @Qualifier("signedDataVerificationExecutor")
                                                           Executor verificationExecutor) {
        return new AsyncSignedDataVerifier(signedDataVerifier, verificationExecutor);
    }

    private static List<byte[]> readRootCertificates(List<Resource> resources) throws IOException {
        List<byte[]> roots = new ArrayList<>(resources.size());
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                roots.add(in.readAllBytes());
            }
            logger.debug("Read root certificate from {}", resource.getDescription());
        }
        return roots;
    }

    private static ThreadPoolTaskExecutor threadPool(String threadNamePrefix, int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setDaemon(true);
        return executor;
    }

}
