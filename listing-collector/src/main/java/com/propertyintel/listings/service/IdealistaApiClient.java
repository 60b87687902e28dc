package com.propertyintel.listings.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listings.config.ListingCollectorProperties;
import com.propertyintel.listings.model.ApiRequestRecord;
import com.propertyintel.listings.model.SearchPage;
import com.propertyintel.listings.model.SearchQuery;
import com.propertyintel.listings.store.ScanLedgerWriter;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thin client over the Idealista search API.
 *
 * Rate limiting: calls are spaced at least rateLimitDelayMs apart (default 1 second).
 * A 429 or 5xx is mapped to a retryable exception and the Resilience4j retry
 * applies exponential backoff.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdealistaApiClient implements ListingFetcher {

    private static final String SEARCH_ENDPOINT = "/search";
    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final IdealistaTokenProvider tokenProvider;
    private final ScanLedgerWriter ledgerWriter;
    private final ObjectMapper objectMapper;
    private final ListingCollectorProperties properties;

    private long lastRequestNanos;

    /**
     * Fetch one page of search results.
     *
     * @param query      search parameters shared by every page of the scan
     * @param pageNumber 1-based page index
     * @param jobId      correlates the api_requests ledger row with the scan
     */
    @Override
    @Retry(name = "idealistaApi")
    public SearchPage fetchPage(SearchQuery query, int pageNumber, String jobId) {
        Map<String, Object> params = searchParams(query, pageNumber);
        Map<String, Object> payload = post(SEARCH_ENDPOINT, params, jobId);
        SearchPage page = SearchPage.fromPayload(payload);
        log.info("Search page {} received: {} items (total={}, totalPages={})",
                pageNumber, page.elements().size(), page.total(), page.totalPages());
        return page;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Map<String, Object> searchParams(SearchQuery query, int pageNumber) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("operation", query.operation());
        params.put("propertyType", query.propertyType());
        params.put("locationId", query.locationId());
        params.put("maxItems", query.maxItems());
        params.put("numPage", pageNumber);
        params.put("order", query.order());
        params.put("sort", query.sort());
        if (query.sinceDate() != null && !query.sinceDate().isBlank()) {
            params.put("sinceDate", query.sinceDate());
        }
        return params;
    }

    private Map<String, Object> post(String endpoint, Map<String, Object> params, String jobId) {
        applyRateLimit();

        ListingCollectorProperties.Api api = properties.getApi();
        String url = api.getBaseUrl() + "/" + api.getCountry() + endpoint;

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenProvider.getToken(jobId));
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        params.forEach((key, value) -> form.add(key, String.valueOf(value)));

        log.debug("Calling Idealista API: {} {}", endpoint, params);
        long started = System.nanoTime();
        ApiRequestRecord.ApiRequestRecordBuilder ledger = ApiRequestRecord.builder()
                .requestType("search")
                .endpoint(endpoint)
                .requestParams(params)
                .jobId(jobId);

        String body;
        try {
            body = restTemplate.postForObject(url, new HttpEntity<>(form, headers), String.class);
        } catch (RestClientResponseException e) {
            HttpStatusCode status = e.getStatusCode();
            ledgerWriter.writeApiRequest(ledger.statusCode(status.value()).durationMs(elapsedMs(started))
                    .errorMessage(e.getMessage()).build());
            throw translate(status, endpoint, e);
        }

        ledgerWriter.writeApiRequest(ledger.statusCode(200).durationMs(elapsedMs(started)).build());

        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, PAYLOAD);
        } catch (JsonProcessingException e) {
            throw new IdealistaApiException("Unreadable search response from " + endpoint, 200, e);
        }
    }

    private IdealistaApiException translate(HttpStatusCode status, String endpoint, RestClientResponseException e) {
        if (status.value() == 429) {
            log.warn("Rate limited (429) by Idealista API");
            return new RateLimitException("Rate limit exceeded on " + endpoint);
        }
        if (status.is5xxServerError()) {
            log.error("Idealista API server error: {}", status.value());
            return new ServerErrorException("Server error " + status.value() + " on " + endpoint, status.value());
        }
        if (status.value() == 401) {
            log.error("Idealista API authentication failed (401), dropping cached token");
            tokenProvider.invalidate();
        }
        return new IdealistaApiException("Idealista API returned HTTP " + status.value() + " on " + endpoint,
                status.value(), e);
    }

    private synchronized void applyRateLimit() {
        long delayNanos = Duration.ofMillis(properties.getApi().getRateLimitDelayMs()).toNanos();
        if (lastRequestNanos != 0) {
            long waitNanos = delayNanos - (System.nanoTime() - lastRequestNanos);
            if (waitNanos > 0) {
                log.debug("Rate limiting, sleeping {}ms", Duration.ofNanos(waitNanos).toMillis());
                sleepNanos(waitNanos);
            }
        }
        lastRequestNanos = System.nanoTime();
    }

    private void sleepNanos(long nanos) {
        try {
            Thread.sleep(Duration.ofNanos(nanos).toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static int elapsedMs(long startedNanos) {
        return (int) Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
