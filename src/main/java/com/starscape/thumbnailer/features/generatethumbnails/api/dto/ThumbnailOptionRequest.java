package com.starscape.thumbnailer.features.generatethumbnails.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailOption;
import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ThumbnailOptionRequest(
    @JsonProperty("dstImage") String dstImage,

    @Valid
    @JsonProperty("rect") RectangleRequest rect,

    @PositiveOrZero(message = "width must not be negative")
    @JsonProperty("width") int width,

    @PositiveOrZero(message = "height must not be negative")
    @JsonProperty("height") int height
) {

    public ThumbnailOption toOption() {
        return new ThumbnailOption(dstImage, rect == null ? null : rect.toCropRectangle(), width, height);
    }
}
