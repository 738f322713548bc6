package com.example.signeddata.config;

import com.example.signeddata.AsyncSignedDataVerifier;
import com.example.signeddata.FakeOcspResponder;
import com.example.signeddata.SignedDataVerifier;
import com.example.signeddata.TestPki;
import com.example.signeddata.TestTokens;
import com.example.signeddata.model.Environment;
import com.example.signeddata.revocation.OcspTransport;
import com.example.signeddata.revocation.RestTemplateOcspTransport;
import com.example.signeddata.revocation.RevocationFailurePolicy;
import org.bouncycastle.cert.ocsp.CertificateStatus;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignedDataVerifierAutoConfigurationTest {

    private static TestPki.Hierarchy pki;

    @TempDir
    static Path certificates;

    private static Path rootFile;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SignedDataVerifierAutoConfiguration.class));

    @BeforeAll
    static void writeRoot() throws Exception {
        pki = TestPki.hierarchy();
        rootFile = Files.write(certificates.resolve("root.cer"), pki.root().encoded());
    }

    private static String rootProperty() {
        return "app.signed-data.root-certificates[0]=file:" + rootFile.toAbsolutePath();
    }

    @Test
    void backsOffWithoutBundleId() {
        contextRunner.withPropertyValues(rootProperty()).run(context -> {
            assertNull(context.getStartupFailure());
            assertTrue(context.getBeansOfType(SignedDataVerifier.class).isEmpty());
        });
    }

    @Test
    void createsVerifierFromProperties() {
        contextRunner.withPropertyValues(rootProperty(),
                        "app.signed-data.bundle-id=com.example",
                        "app.signed-data.environment=Sandbox",
                        "app.signed-data.app-apple-id=531412")
                .run(context -> {
                    SignedDataVerifier verifier = context.getBean(SignedDataVerifier.class);
                    assertEquals(Environment.SANDBOX, verifier.getContext().environment());
                    assertEquals(531412L, verifier.getContext().appAppleId());
                    assertFalse(verifier.getContext().revocationCheckEnabled());
                    assertNotNull(context.getBean(AsyncSignedDataVerifier.class));
                    assertInstanceOf(RestTemplateOcspTransport.class, context.getBean(OcspTransport.class));

                    String token = TestTokens.sign(Map.of("bundleId", "com.example", "environment", "Sandbox",
                            "transactionId", "7"), pki);
                    assertEquals("7", verifier.verifyAndDecodeTransaction(token).getTransactionId());
                    assertEquals("7", context.getBean(AsyncSignedDataVerifier.class)
                            .verifyAndDecodeTransaction(token).get().getTransactionId());
                });
    }

    @Test
    void wiresRevocationSettingsAndCustomTransport() {
        FakeOcspResponder responder = new FakeOcspResponder()
                .respond(pki.leaf(), pki.intermediate(), CertificateStatus.GOOD)
                .respond(pki.intermediate(), pki.root(), CertificateStatus.GOOD);

        contextRunner.withBean(OcspTransport.class, () -> responder)
                .withPropertyValues(rootProperty(),
                        "app.signed-data.bundle-id=com.example",
                        "app.signed-data.environment=Sandbox",
                        "app.signed-data.revocation.enabled=true",
                        "app.signed-data.revocation.fail-open=true",
                        "app.signed-data.revocation.timeout=2s")
                .run(context -> {
                    SignedDataVerifierProperties properties = context.getBean(SignedDataVerifierProperties.class);
                    assertEquals(Duration.ofSeconds(2), properties.getRevocation().getTimeout());

                    SignedDataVerifier verifier = context.getBean(SignedDataVerifier.class);
                    assertEquals(RevocationFailurePolicy.FAIL_OPEN, verifier.getContext().revocationFailurePolicy());

                    verifier.verifyAndDecodeTransaction(TestTokens.sign(Map.of("bundleId", "com.example",
                            "environment", "Sandbox", "transactionId", "8"), pki));
                    assertEquals(2, responder.requests().size());
                });
    }

    @Test
    void failsStartupOnUnreadableRoot() throws Exception {
        Path garbage = Files.write(certificates.resolve("garbage.cer"), new byte[]{1, 2, 3});

        contextRunner.withPropertyValues("app.signed-data.root-certificates[0]=file:" + garbage.toAbsolutePath(),
                        "app.signed-data.bundle-id=com.example")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void failsStartupWithoutRoots() {
        contextRunner.withPropertyValues("app.signed-data.bundle-id=com.example")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

}
