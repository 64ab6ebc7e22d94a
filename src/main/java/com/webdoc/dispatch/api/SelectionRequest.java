package com.webdoc.dispatch.api;

import java.util.List;

/**
 * Request body for POST /api/v1/session/selection.
 *
 * @param selected topic IDs to generate documents for, in processing order
 */
public record SelectionRequest(List<Integer> selected) {}
