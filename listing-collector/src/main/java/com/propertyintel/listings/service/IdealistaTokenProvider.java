package com.propertyintel.listings.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.propertyintel.listings.config.ListingCollectorProperties;
import com.propertyintel.listings.model.ApiRequestRecord;
import com.propertyintel.listings.store.ScanLedgerWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * OAuth2 client-credentials token for the Idealista API.
 *
 * Tokens live for an hour; the cached one is replaced five minutes before it
 * expires, or immediately after {@link #invalidate()}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdealistaTokenProvider {

    static final long DEFAULT_VALIDITY_SECONDS = 3600;
    static final Duration REFRESH_BUFFER = Duration.ofMinutes(5);

    private final RestTemplate restTemplate;
    private final ListingCollectorProperties properties;
    private final ScanLedgerWriter ledgerWriter;
    private final Clock clock;

    private String token;
    private Instant expiresAt;

    public synchronized String getToken(String jobId) {
        if (token == null || expiresAt == null || !clock.instant().plus(REFRESH_BUFFER).isBefore(expiresAt)) {
            log.info("Token expired or missing, requesting new token");
            requestNewToken(jobId);
        }
        return token;
    }

    public synchronized void invalidate() {
        token = null;
        expiresAt = null;
        log.info("Token cache invalidated");
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void requestNewToken(String jobId) {
        ListingCollectorProperties.Api api = properties.getApi();
        if (api.getApiKey() == null || api.getApiSecret() == null) {
            throw new IdealistaApiException("Idealista API key and secret must be configured", null);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(api.getApiKey(), api.getApiSecret());
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("scope", "read");

        long started = System.nanoTime();
        ApiRequestRecord.ApiRequestRecordBuilder ledger = ApiRequestRecord.builder()
                .requestType("oauth_token")
                .endpoint("/oauth/token")
                .requestParams(Map.of("grant_type", "client_credentials", "scope", "read"))
                .jobId(jobId);

        try {
            JsonNode body = restTemplate.postForObject(api.getTokenUrl(), new HttpEntity<>(form, headers), JsonNode.class);
            ledgerWriter.writeApiRequest(ledger.statusCode(200).durationMs(elapsedMs(started)).build());

            if (body == null || !body.hasNonNull("access_token")) {
                throw new IdealistaApiException("Token response had no access_token", 200);
            }
            long validity = body.path("expires_in").asLong(DEFAULT_VALIDITY_SECONDS);
            token = body.get("access_token").asText();
            expiresAt = clock.instant().plusSeconds(validity);
            log.info("OAuth2 token obtained, expires at {}", expiresAt);

        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            ledgerWriter.writeApiRequest(ledger.statusCode(status).durationMs(elapsedMs(started))
                    .errorMessage(e.getMessage()).build());
            if (status == 401) {
                log.error("OAuth2 authentication failed - invalid credentials");
            }
            throw new IdealistaApiException("Token request failed with HTTP " + status, status, e);
        }
    }

    private static int elapsedMs(long startedNanos) {
        return (int) Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
