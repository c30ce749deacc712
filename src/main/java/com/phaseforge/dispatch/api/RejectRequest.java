package com.phaseforge.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/runs/{id}/reject.
 */
public record RejectRequest(String reason) {}
