package com.example.signeddata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.util.Base64;
import com.nimbusds.jose.util.Base64URL;

import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECPrivateKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Signs and manipulates compact ES256 tokens for tests.
 */
public final class TestTokens {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestTokens() {
    }

    public static String sign(Map<String, ?> payload, TestPki.CertifiedKey signer, List<X509Certificate> chain) {
        return sign(json(payload), signer.keyPair().getPrivate(), chain, null);
    }

    public static String sign(Map<String, ?> payload, TestPki.Hierarchy pki) {
        return sign(payload, pki.leaf(), pki.chain());
    }

    public static String sign(String payloadJson, PrivateKey key, List<X509Certificate> chain, String keyId) {
        try {
            JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.ES256)
                    .x509CertChain(encodeChain(chain))
                    .keyID(keyId)
                    .build();
            JWSObject jws = new JWSObject(header, new Payload(payloadJson));
            jws.sign(new ECDSASigner((ECPrivateKey) key));
            return jws.serialize();
        } catch (Exception e) {
            throw new IllegalStateException("Could not sign test token", e);
        }
    }

    public static List<Base64> encodeChain(List<X509Certificate> chain) {
        List<Base64> encoded = new ArrayList<>();
        for (X509Certificate certificate : chain) {
            try {
                encoded.add(Base64.encode(certificate.getEncoded()));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        return encoded;
    }

    /**
     * Header JSON with the given {@code alg} and chain; used for tokens that are never validly signed.
     */
    public static String header(String alg, List<X509Certificate> chain) {
        List<String> x5c = new ArrayList<>();
        for (Base64 certificate : encodeChain(chain)) {
            x5c.add(certificate.toString());
        }
        return json(Map.of("alg", alg, "x5c", x5c));
    }

    public static String compact(String headerJson, String payloadJson, byte[] signature) {
        return segment(headerJson) + "." + segment(payloadJson) + "." + Base64URL.encode(signature);
    }

    public static String segment(String json) {
        return Base64URL.encode(json.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static String json(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    public static String[] parts(String token) {
        return token.split("\\.");
    }

    public static String replacePayload(String token, String payloadJson) {
        String[] parts = parts(token);
        return parts[0] + "." + segment(payloadJson) + "." + parts[2];
    }

    public static String replaceHeader(String token, String headerJson) {
        String[] parts = parts(token);
        return segment(headerJson) + "." + parts[1] + "." + parts[2];
    }

    public static String flipSignatureBit(String token) {
        String[] parts = parts(token);
        byte[] signature = new Base64URL(parts[2]).decode();
        signature[10] ^= 0x01;
        return parts[0] + "." + parts[1] + "." + Base64URL.encode(signature);
    }

    public static final String BASE64URL_ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";

    public static char nextBase64UrlChar(char c) {
        int index = BASE64URL_ALPHABET.indexOf(c);
        return BASE64URL_ALPHABET.charAt((index + 1) % BASE64URL_ALPHABET.length());
    }

    /**
     * Rewrites the unused low bits of the last signature character, leaving the decoded bytes unchanged.
     */
    public static String withNonCanonicalSignatureTail(String token) {
        int last = token.length() - 1;
        int index = BASE64URL_ALPHABET.indexOf(token.charAt(last));
        char replacement = BASE64URL_ALPHABET.charAt(index ^ 0x01);
        return token.substring(0, last) + replacement;
    }

    public static String decodedHeader(String token) {
        return new Base64URL(parts(token)[0]).decodeToString();
    }

}
