package io.easel.server.dto;

import java.util.Map;

/**
 * JSON response for POST /images/validate. Keys keep request order.
 */
public class ValidateResponse {
    public Map<String, Boolean> results;
}
