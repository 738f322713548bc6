package com.example.signeddata.token;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.TestPki;
import com.example.signeddata.TestTokens;
import com.example.signeddata.VerificationError;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TokenParserTest {

    private static TestPki.Hierarchy pki;

    private final TokenParser parser = new TokenParser();

    @BeforeAll
    static void createPki() {
        pki = TestPki.hierarchy();
    }

    @Test
    void parsesSegmentsAlgorithmAndChain() throws Exception {
        String token = TestTokens.sign(Map.of("transactionId", "1000"), pki);

        CompactToken parsed = parser.parse(token);

        assertEquals("ES256", parsed.algorithm());
        assertNotNull(parsed.header());
        assertEquals(2, parsed.certificateChain().size());
        assertArrayEquals(pki.leaf().encoded(), parsed.certificateChain().get(0).decode());
        String[] parts = TestTokens.parts(token);
        assertArrayEquals((parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII), parsed.signingInput());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "a.b", "a.b.c.d", "a..c", "a.b.", "a+b.c.d", "a.b/c.d"})
    void rejectsTokensWithoutThreeBase64UrlSegments(String token) {
        SignedDataVerificationException e = assertThrows(SignedDataVerificationException.class,
                () -> parser.parse(token));
        assertEquals(VerificationError.MALFORMED_TOKEN, e.getError());
    }

    @Test
    void rejectsNullToken() {
        SignedDataVerificationException e = assertThrows(SignedDataVerificationException.class,
                () -> parser.parse(null));
        assertEquals(VerificationError.MALFORMED_TOKEN, e.getError());
    }

    @Test
    void rejectsHeaderThatIsNotJson() {
        String token = TestTokens.segment("not json") + "." + TestTokens.segment("{}") + ".c2ln";

        SignedDataVerificationException e = assertThrows(SignedDataVerificationException.class,
                () -> parser.parse(token));
        assertEquals(VerificationError.MALFORMED_TOKEN, e.getError());
    }

    @Test
    void rejectsHeaderWithoutAlgorithm() {
        String header = TestTokens.json(Map.of("x5c", List.of("AAAA")));
        String token = TestTokens.compact(header, "{}", new byte[64]);

        SignedDataVerificationException e = assertThrows(SignedDataVerificationException.class,
                () -> parser.parse(token));
        assertEquals(VerificationError.MALFORMED_TOKEN, e.getError());
    }

    @Test
    void rejectsHeaderWithoutCertificateChain() {
        String token = TestTokens.compact(TestTokens.json(Map.of("alg", "ES256")), "{}", new byte[64]);

        SignedDataVerificationException e = assertThrows(SignedDataVerificationException.class,
                () -> parser.parse(token));
        assertEquals(VerificationError.MISSING_CERTIFICATE_CHAIN, e.getError());
    }

    @Test
    void rejectsEmptyCertificateChain() {
        String header = TestTokens.json(Map.of("alg", "ES256", "x5c", List.of()));
        String token = TestTokens.compact(header, "{}", new byte[64]);

        SignedDataVerificationException e = assertThrows(SignedDataVerificationException.class,
                () -> parser.parse(token));
        assertEquals(VerificationError.MISSING_CERTIFICATE_CHAIN, e.getError());
    }

    @Test
    void rejectsChainThatIsNotAnArray() {
        String header = TestTokens.json(Map.of("alg", "ES256", "x5c", "AAAA"));
        String token = TestTokens.compact(header, "{}", new byte[64]);

        SignedDataVerificationException e = assertThrows(SignedDataVerificationException.class,
                () -> parser.parse(token));
        assertEquals(VerificationError.MALFORMED_TOKEN, e.getError());
    }

    @Test
    void keepsNonJwsAlgorithmForTheSignatureStage() throws Exception {
        String token = TestTokens.compact(TestTokens.header("none", pki.chain()), "{}", new byte[64]);

        CompactToken parsed = parser.parse(token);

        assertEquals("none", parsed.algorithm());
        assertNull(parsed.header());
    }

    @Test
    void doesNotExposeTokenContentInToString() throws Exception {
        String token = TestTokens.sign(Map.of("transactionId", "secret-transaction"), pki);

        String description = parser.parse(token).toString();

        assertFalse(description.contains("secret"));
        assertFalse(description.contains(TestTokens.parts(token)[1]));
    }

}
