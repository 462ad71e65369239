package com.riftinsight.infrastructure.riot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Thin HTTP client for the Riot developer API and Data Dragon.
 *
 * Responsibilities:
 * - Sends the API key header on Riot hosts
 * - Decodes gzip bodies itself, so a body whose declared Content-Encoding does not
 *   match its payload surfaces as MALFORMED_RESPONSE instead of a generic I/O error
 * - Maps HTTP and transport failures to {@link UpstreamFailureKind}
 *
 * It does not rate-limit, retry or cache. That is {@link UpstreamGateway}'s job.
 */
@Slf4j
@Component
public class RiotApiClient {

    static final String TOKEN_HEADER = "X-Riot-Token";

    public enum Encoding {
        GZIP("gzip"),
        IDENTITY("identity");

        private final String headerValue;

        Encoding(String headerValue) {
            this.headerValue = headerValue;
        }

        public String headerValue() {
            return headerValue;
        }
    }

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RiotEndpoints endpoints;
    private final String apiKey;

    public RiotApiClient(
            @Qualifier("riotRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            RiotEndpoints endpoints,
            @Value("${app.riot.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoints = endpoints;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    /**
     * GET a JSON document.
     *
     * @param encoding response encoding to ask for; IDENTITY disables compression
     * @throws UpstreamException on any failure, classified by kind
     */
    public JsonNode getJson(URI uri, Encoding encoding) {
        byte[] body;
        try {
            body = restTemplate.execute(uri, HttpMethod.GET,
                    request -> {
                        HttpHeaders headers = request.getHeaders();
                        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                        headers.set(HttpHeaders.ACCEPT_ENCODING, encoding.headerValue());
                        if (!apiKey.isEmpty() && !endpoints.isStaticData(uri)) {
                            headers.set(TOKEN_HEADER, apiKey);
                        }
                    },
                    response -> decodeBody(uri, response));
        } catch (HttpClientErrorException.NotFound e) {
            throw new UpstreamException(UpstreamFailureKind.NOT_FOUND, 404, "Not found: " + uri.getPath(), e);
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited by upstream on {} (Retry-After={})",
                    uri.getPath(), retryAfter(e));
            throw new UpstreamException(UpstreamFailureKind.RATE_LIMITED, 429, "Rate limited: " + uri.getPath(), e);
        } catch (HttpClientErrorException e) {
            throw new UpstreamException(UpstreamFailureKind.CLIENT_ERROR, e.getStatusCode().value(),
                    "Upstream rejected request (" + e.getStatusCode().value() + "): " + uri.getPath(), e);
        } catch (HttpServerErrorException e) {
            throw new UpstreamException(UpstreamFailureKind.TRANSIENT, e.getStatusCode().value(),
                    "Upstream error (" + e.getStatusCode().value() + "): " + uri.getPath(), e);
        } catch (RestClientResponseException e) {
            throw new UpstreamException(UpstreamFailureKind.TRANSIENT, e.getStatusCode().value(),
                    "Unexpected upstream status " + e.getStatusCode().value() + ": " + uri.getPath(), e);
        } catch (ResourceAccessException e) {
            throw new UpstreamException(UpstreamFailureKind.TRANSIENT, 0,
                    "Network error calling " + uri.getPath() + ": " + e.getMessage(), e);
        }

        if (body == null || body.length == 0) {
            throw new UpstreamException(UpstreamFailureKind.MALFORMED_RESPONSE, "Empty body from " + uri.getPath());
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UpstreamException(UpstreamFailureKind.MALFORMED_RESPONSE, 200,
                    "Response from " + uri.getPath() + " is not valid JSON", e);
        }
    }

    private byte[] decodeBody(URI uri, ClientHttpResponse response) throws IOException {
        byte[] raw = StreamUtils.copyToByteArray(response.getBody());
        String contentEncoding = response.getHeaders().getFirst(HttpHeaders.CONTENT_ENCODING);
        if (contentEncoding == null || !contentEncoding.toLowerCase(Locale.ROOT).contains("gzip")) {
            return raw;
        }
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return in.readAllBytes();
        } catch (IOException e) {
            // thrown unchecked so RestTemplate does not rewrap it as a network error
            throw new UpstreamException(UpstreamFailureKind.MALFORMED_RESPONSE, response.getStatusCode().value(),
                    "Declared gzip encoding does not match payload from " + uri.getPath(), e);
        }
    }

    private static String retryAfter(HttpClientErrorException e) {
        HttpHeaders headers = e.getResponseHeaders();
        return headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
    }
}
