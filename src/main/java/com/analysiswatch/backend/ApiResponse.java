package com.analysiswatch.backend;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Status code and parsed JSON body of a backend response.
 *
 * @param statusCode HTTP status code
 * @param body       parsed body; a {@code MissingNode} when the body was empty
 */
public record ApiResponse(int statusCode, JsonNode body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isAuthFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
