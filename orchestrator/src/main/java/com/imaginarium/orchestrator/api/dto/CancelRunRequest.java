package com.imaginarium.orchestrator.api.dto;

/** Optional body for POST /runs/{id}/cancel. */
public record CancelRunRequest(String reason) {}
