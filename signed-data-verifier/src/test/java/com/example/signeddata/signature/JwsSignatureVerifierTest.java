package com.example.signeddata.signature;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.TestPki;
import com.example.signeddata.TestTokens;
import com.example.signeddata.VerificationError;
import com.example.signeddata.token.CompactToken;
import com.example.signeddata.token.TokenParser;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JwsSignatureVerifierTest {

    private static TestPki.Hierarchy pki;

    private final TokenParser parser = new TokenParser();
    private final JwsSignatureVerifier verifier = new JwsSignatureVerifier();

    @BeforeAll
    static void createPki() {
        pki = TestPki.hierarchy();
    }

    private String signedToken() {
        return TestTokens.sign(Map.of("transactionId", "1000", "bundleId", "com.example"), pki);
    }

    private VerificationError failure(String token, PublicKey key) throws Exception {
        CompactToken parsed = parser.parse(token);
        return assertThrows(SignedDataVerificationException.class, () -> verifier.verify(parsed, key)).getError();
    }

    @Test
    void acceptsSignatureFromLeafKey() throws Exception {
        CompactToken token = parser.parse(signedToken());

        assertDoesNotThrow(() -> verifier.verify(token, pki.leaf().certificate().getPublicKey()));
    }

    @Test
    void rejectsSignatureUnderDifferentKey() throws Exception {
        PublicKey otherKey = TestPki.ecKeyPair().getPublic();

        assertEquals(VerificationError.INVALID_SIGNATURE, failure(signedToken(), otherKey));
    }

    @Test
    void rejectsModifiedPayload() throws Exception {
        String tampered = TestTokens.replacePayload(signedToken(),
                "{\"transactionId\":\"1001\",\"bundleId\":\"com.example\"}");

        assertEquals(VerificationError.INVALID_SIGNATURE,
                failure(tampered, pki.leaf().certificate().getPublicKey()));
    }

    @Test
    void rejectsModifiedHeader() throws Exception {
        String token = signedToken();
        String header = TestTokens.decodedHeader(token).replace("{", "{\"kid\":\"injected\",");

        assertEquals(VerificationError.INVALID_SIGNATURE,
                failure(TestTokens.replaceHeader(token, header), pki.leaf().certificate().getPublicKey()));
    }

    @Test
    void rejectsModifiedSignature() throws Exception {
        assertEquals(VerificationError.INVALID_SIGNATURE,
                failure(TestTokens.flipSignatureBit(signedToken()), pki.leaf().certificate().getPublicKey()));
    }

    @Test
    void rejectsNonCanonicalSignatureEncoding() throws Exception {
        String token = signedToken();
        String tampered = TestTokens.withNonCanonicalSignatureTail(token);

        assertNotEquals(token, tampered);
        assertArrayEquals(parser.parse(token).signatureSegment().decode(),
                parser.parse(tampered).signatureSegment().decode());
        assertEquals(VerificationError.INVALID_SIGNATURE,
                failure(tampered, pki.leaf().certificate().getPublicKey()));
    }

    @Test
    void rejectsTruncatedSignature() throws Exception {
        String token = TestTokens.compact(TestTokens.decodedHeader(signedToken()), "{}", new byte[10]);

        assertEquals(VerificationError.INVALID_SIGNATURE, failure(token, pki.leaf().certificate().getPublicKey()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"none", "HS256", "RS256", "ES384", "PS256", "EdDSA"})
    void rejectsAlgorithmsOtherThanEs256(String alg) throws Exception {
        String token = TestTokens.compact(TestTokens.header(alg, pki.chain()), "{}", new byte[64]);

        assertEquals(VerificationError.UNSUPPORTED_ALGORITHM, failure(token, pki.leaf().certificate().getPublicKey()));
    }

    @Test
    void rejectsNonEcLeafKey() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);

        assertEquals(VerificationError.INVALID_SIGNATURE, failure(signedToken(), generator.generateKeyPair().getPublic()));
    }

}
