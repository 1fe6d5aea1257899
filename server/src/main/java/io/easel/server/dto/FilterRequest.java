package io.easel.server.dto;

import java.util.List;

/**
 * JSON body for POST /recommendations/filter.
 */
public class FilterRequest {
    public List<RecommendationItem> items;
}
