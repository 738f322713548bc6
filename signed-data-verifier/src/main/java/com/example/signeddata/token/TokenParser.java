package com.example.signeddata.token;

import com.example.signeddata.SignedDataVerificationException;
import com.example.signeddata.VerificationError;
import com.nimbusds.jose.Algorithm;
import com.nimbusds.jose.Header;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.util.Base64;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jose.util.JSONObjectUtils;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits a compact token into header, payload and signature and extracts the declared
 * algorithm and embedded certificate chain from the header.
 */
public class TokenParser {

    private static final Pattern BASE64URL_SEGMENT = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String X5C = "x5c";

    public CompactToken parse(String token) throws SignedDataVerificationException {
        if (token == null) {
            throw new SignedDataVerificationException(VerificationError.MALFORMED_TOKEN, "Token is null");
        }

        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != 3) {
            throw new SignedDataVerificationException(VerificationError.MALFORMED_TOKEN,
                    "Token must have exactly 3 segments, found " + parts.length);
        }
        for (String part : parts) {
            if (!BASE64URL_SEGMENT.matcher(part).matches()) {
                throw new SignedDataVerificationException(VerificationError.MALFORMED_TOKEN,
                        "Token segment is empty or not base64url encoded");
            }
        }

        Base64URL headerSegment = new Base64URL(parts[0]);
        Map<String, Object> headerJson;
        Algorithm algorithm;
        try {
            headerJson = JSONObjectUtils.parse(headerSegment.decodeToString());
            algorithm = Header.parseAlgorithm(headerJson);
        } catch (ParseException e) {
            throw new SignedDataVerificationException(VerificationError.MALFORMED_TOKEN,
                    "Token header is not a valid JSON object with an alg parameter", e);
        }

        List<Base64> chain = parseCertificateChain(headerJson);

        // alg values such as "none" or JWE algorithms cannot form a JWS header;
        // they are rejected as unsupported by the signature stage
        JWSHeader jwsHeader = null;
        if (algorithm instanceof JWSAlgorithm) {
            try {
                jwsHeader = JWSHeader.parse(headerJson, headerSegment);
            } catch (ParseException e) {
                throw new SignedDataVerificationException(VerificationError.MALFORMED_TOKEN,
                        "Token header is not a valid JWS header: " + e.getMessage(), e);
            }
        }

        return new CompactToken(token, headerSegment, new Base64URL(parts[1]), new Base64URL(parts[2]),
                algorithm.getName(), jwsHeader, chain);
    }

    private List<Base64> parseCertificateChain(Map<String, Object> headerJson) throws SignedDataVerificationException {
        List<String> encoded;
        try {
            encoded = JSONObjectUtils.getStringList(headerJson, X5C);
        } catch (ParseException e) {
            throw new SignedDataVerificationException(VerificationError.MALFORMED_TOKEN,
                    "x5c header must be an array of strings", e);
        }
        if (encoded == null || encoded.isEmpty()) {
            throw new SignedDataVerificationException(VerificationError.MISSING_CERTIFICATE_CHAIN,
                    "Token header carries no x5c certificate chain");
        }

        List<Base64> chain = new ArrayList<>(encoded.size());
        for (String certificate : encoded) {
            chain.add(new Base64(certificate));
        }
        return chain;
    }

}
