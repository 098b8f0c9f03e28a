package com.starscape.thumbnailer.features.generatethumbnails.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailResult;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record ThumbnailResultResponse(
    @JsonProperty("thumbnail") String thumbnail,
    @JsonProperty("err") String err
) {

    public static ThumbnailResultResponse from(ThumbnailResult result) {
        if (result.succeeded()) {
            return new ThumbnailResultResponse(result.thumbnail().toString(), null);
        }
        return new ThumbnailResultResponse(null, result.error().getMessage());
    }
}
