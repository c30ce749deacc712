package com.phaseforge.dispatch.api;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/runs.
 *
 * @param params request parameters kept with the run as metadata; nullable
 */
public record StartRunRequest(Map<String, String> params) {}
