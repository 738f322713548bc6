package com.example.signeddata;

import com.example.signeddata.model.AppTransaction;
import com.example.signeddata.model.DecodedPayload;
import com.example.signeddata.model.NotificationEnvelope;
import com.example.signeddata.model.RenewalInfo;
import com.example.signeddata.model.TransactionInfo;
import org.springframework.util.Assert;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs {@link SignedDataVerifier} calls on a separate executor so callers on an event loop
 * never wait on a revocation round trip. A failed verification completes the future
 * exceptionally with the {@link SignedDataVerificationException}.
 */
public class AsyncSignedDataVerifier {

    private final SignedDataVerifier verifier;
    private final Executor executor;

    public AsyncSignedDataVerifier(SignedDataVerifier verifier, Executor executor) {
        Assert.notNull(verifier, "verifier must not be null");
        Assert.notNull(executor, "executor must not be null");
        this.verifier = verifier;
        this.executor = executor;
    }

    public CompletableFuture<NotificationEnvelope> verifyAndDecodeNotification(String token) {
        return supply(() -> verifier.verifyAndDecodeNotification(token));
    }

    public CompletableFuture<TransactionInfo> verifyAndDecodeTransaction(String token) {
        return supply(() -> verifier.verifyAndDecodeTransaction(token));
    }

    public CompletableFuture<RenewalInfo> verifyAndDecodeRenewalInfo(String token) {
        return supply(() -> verifier.verifyAndDecodeRenewalInfo(token));
    }

    public CompletableFuture<AppTransaction> verifyAndDecodeAppTransaction(String token) {
        return supply(() -> verifier.verifyAndDecodeAppTransaction(token));
    }

    public CompletableFuture<DecodedPayload> verifyAndDecode(String token) {
        return supply(() -> verifier.verifyAndDecode(token));
    }

    private <T> CompletableFuture<T> supply(Verification<T> verification) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(verification.run());
                } catch (SignedDataVerificationException | RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    @FunctionalInterface
    private interface Verification<T> {
        T run() throws SignedDataVerificationException;
    }

}
