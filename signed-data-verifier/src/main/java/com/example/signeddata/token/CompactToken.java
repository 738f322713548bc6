package com.example.signeddata.token;

import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.util.Base64;
import com.nimbusds.jose.util.Base64URL;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A compact token split into its three segments. The payload segment is kept encoded;
 * nothing reads it before the signature over it has been verified.
 *
 * @param raw              the token as received
 * @param headerSegment    header segment as transmitted
 * @param payloadSegment   payload segment as transmitted
 * @param signatureSegment signature segment as transmitted
 * @param algorithm        the declared {@code alg} header value
 * @param header           the parsed JWS header, or {@code null} when {@code alg} does not name a JWS algorithm
 * @param certificateChain leaf-first {@code x5c} entries
 */
public record CompactToken(
        String raw,
        Base64URL headerSegment,
        Base64URL payloadSegment,
        Base64URL signatureSegment,
        String algorithm,
        JWSHeader header,
        List<Base64> certificateChain
) {

    public CompactToken {
        certificateChain = List.copyOf(certificateChain);
    }

    /**
     * The exact bytes the signature was computed over: {@code header || '.' || payload}.
     */
    public byte[] signingInput() {
        return (headerSegment.toString() + '.' + payloadSegment.toString()).getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    public String toString() {
        return "CompactToken[alg=" + algorithm + ", chainLength=" + certificateChain.size() + "]";
    }

}
