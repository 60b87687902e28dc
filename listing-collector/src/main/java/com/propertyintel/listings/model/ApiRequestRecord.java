package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * One outbound Idealista call, written to the api_requests ledger.
 */
@Data
@Builder
public class ApiRequestRecord {

    private String requestType;     // oauth_token | search
    private String endpoint;
    private Integer statusCode;     // null when no response was received
    private Integer durationMs;
    private Map<String, Object> requestParams;
    private String errorMessage;
    private String jobId;
}
