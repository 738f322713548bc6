package com.example.signeddata.revocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * {@link OcspTransport} posting requests over HTTP (RFC 6960 Appendix A.1).
 */
public class RestTemplateOcspTransport implements OcspTransport {

    private static final Logger logger = LoggerFactory.getLogger(RestTemplateOcspTransport.class);

    static final MediaType OCSP_REQUEST = MediaType.parseMediaType("application/ocsp-request");
    static final MediaType OCSP_RESPONSE = MediaType.parseMediaType("application/ocsp-response");

    private final RestTemplate restTemplate;

    public RestTemplateOcspTransport(Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        this.restTemplate = new RestTemplate(requestFactory);
    }

    public RestTemplateOcspTransport(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public byte[] send(URI responderUri, byte[] ocspRequest) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(OCSP_REQUEST);
        headers.setAccept(List.of(OCSP_RESPONSE));

        logger.debug("Posting OCSP request to {}", responderUri);
        try {
            byte[] response = restTemplate.postForObject(responderUri, new HttpEntity<>(ocspRequest, headers),
                    byte[].class);
            if (response == null || response.length == 0) {
                throw new IOException("Empty response from OCSP responder " + responderUri);
            }
            return response;
        } catch (RestClientException e) {
            throw new IOException("OCSP request to " + responderUri + " failed: " + e.getMessage(), e);
        }
    }

}
