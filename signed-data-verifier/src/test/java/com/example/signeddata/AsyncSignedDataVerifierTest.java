package com.example.signeddata;

import com.example.signeddata.model.Environment;
import com.example.signeddata.model.TransactionInfo;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AsyncSignedDataVerifierTest {

    private static TestPki.Hierarchy pki;
    private static ExecutorService executor;
    private static AsyncSignedDataVerifier asyncVerifier;

    @BeforeAll
    static void setUp() throws Exception {
        pki = TestPki.hierarchy();
        executor = Executors.newFixedThreadPool(2, new CustomizableThreadFactory("verify-test-"));
        asyncVerifier = new AsyncSignedDataVerifier(
                new SignedDataVerifier(pki.roots(), Environment.SANDBOX, "com.example", null, false), executor);
    }

    @AfterAll
    static void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void completesWithDecodedPayloadOnExecutorThread() throws Exception {
        String token = TestTokens.sign(Map.of("bundleId", "com.example", "environment", "Sandbox",
                "transactionId", "42"), pki);
        AtomicReference<String> thread = new AtomicReference<>();

        TransactionInfo transaction = asyncVerifier.verifyAndDecodeTransaction(token)
                .whenComplete((result, failure) -> thread.set(Thread.currentThread().getName()))
                .get(5, TimeUnit.SECONDS);

        assertEquals("42", transaction.getTransactionId());
        assertNotNull(thread.get());
    }

    @Test
    void completesExceptionallyWithVerificationFailure() {
        String token = TestTokens.sign(Map.of("bundleId", "com.other", "environment", "Sandbox",
                "transactionId", "42"), pki);

        CompletableFuture<TransactionInfo> result = asyncVerifier.verifyAndDecodeTransaction(token);

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        SignedDataVerificationException cause = assertInstanceOf(SignedDataVerificationException.class, e.getCause());
        assertEquals(VerificationError.INVALID_BUNDLE_ID, cause.getError());
    }

    @Test
    void exposesEveryOperation() {
        for (CompletableFuture<?> future : new CompletableFuture<?>[]{
                asyncVerifier.verifyAndDecodeNotification("x"),
                asyncVerifier.verifyAndDecodeRenewalInfo("x"),
                asyncVerifier.verifyAndDecodeAppTransaction("x"),
                asyncVerifier.verifyAndDecode("x")}) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertEquals(VerificationError.MALFORMED_TOKEN,
                    ((SignedDataVerificationException) e.getCause()).getError());
        }
    }

    @Test
    void rejectedSubmissionFailsTheFuture() throws Exception {
        AsyncSignedDataVerifier rejecting = new AsyncSignedDataVerifier(
                new SignedDataVerifier(pki.roots(), Environment.SANDBOX, "com.example", null, false),
                task -> {
                    throw new RejectedExecutionException("saturated");
                });

        CompletableFuture<TransactionInfo> result = rejecting.verifyAndDecodeTransaction("x");

        assertTrue(result.isCompletedExceptionally());
    }

}
