/*
 * Where: Lab jobs API
 * What: Error body shared by every endpoint
 * Why: Clients read one shape for all failures
 */
package com.example.labjobs.api;

public record ApiErrorResponse(String code, String message) {}
