package com.starscape.thumbnailer.features.generatethumbnails.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.thumbnailer.features.generatethumbnails.domain.CropRectangle;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RectangleRequest(
    @NotNull(message = "rect.min is required")
    @Size(min = 2, max = 2, message = "rect.min must be [x, y]")
    @JsonProperty("min") int[] min,

    @NotNull(message = "rect.max is required")
    @Size(min = 2, max = 2, message = "rect.max must be [x, y]")
    @JsonProperty("max") int[] max
) {

    public CropRectangle toCropRectangle() {
        return new CropRectangle(min[0], min[1], max[0], max[1]);
    }
}
