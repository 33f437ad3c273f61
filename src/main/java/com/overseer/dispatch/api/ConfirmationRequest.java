package com.overseer.dispatch.api;

/**
 * Optional JSON body for the confirm and acknowledge endpoints.
 *
 * @param operator who confirmed; defaults to "operator"
 */
public record ConfirmationRequest(String operator) {}
