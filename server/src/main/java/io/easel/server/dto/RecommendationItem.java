// file: server/src/main/java/io/easel/server/dto/RecommendationItem.java
package io.easel.server.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One recommendation as produced by the scoring service.
 *
 * Only the image fields are interpreted here. Every other property (score,
 * artist, price, ...) is kept in {@link #extra} and written back unchanged,
 * so filtering never strips data from an item.
 *
 * Example:
 *   {
 *     "id": "a-17",
 *     "title": "Water Lilies",
 *     "image_url": "https://img.example.org/a-17.jpg",
 *     "score": 0.93
 *   }
 *
 * Items may wrap the artwork instead: {"artwork": {...}, "score": 0.93}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendationItem {

    public String id;
    public String title;

    @JsonProperty("image_url")
    public String imageUrl;

    @JsonProperty("thumbnail_url")
    public String thumbnailUrl;

    public String primaryImage;
    public String primaryImageSmall;

    /** Nested artwork; when present its image fields take precedence. */
    public RecommendationItem artwork;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    public RecommendationItem() {
    }

    public RecommendationItem(String id, String title, String imageUrl) {
        this.id = id;
        this.title = title;
        this.imageUrl = imageUrl;
    }

    /**
     * First non-blank of image_url, thumbnail_url, primaryImage,
     * primaryImageSmall, read from the nested artwork when there is one.
     *
     * @return the URL, or null if the item carries no image at all.
     */
    public String bestImageUrl() {
        RecommendationItem source = artwork != null ? artwork : this;
        for (String candidate : new String[]{
                source.imageUrl, source.thumbnailUrl, source.primaryImage, source.primaryImageSmall}) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }

    /** Title of the artwork for log lines. */
    public String displayTitle() {
        RecommendationItem source = artwork != null ? artwork : this;
        return source.title != null ? source.title : "Unknown";
    }

    @JsonAnySetter
    public void setExtra(String name, Object value) {
        extra.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> extra() {
        return extra;
    }
}
