package io.easel.server.dto;

import java.util.List;

/**
 * JSON response for POST /recommendations/filter.
 */
public class FilterResponse {
    public List<RecommendationItem> items; // survivors, in request order
    public int filteredOut;                // items dropped for a dead or missing image
}
