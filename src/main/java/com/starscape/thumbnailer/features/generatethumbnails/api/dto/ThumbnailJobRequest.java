package com.starscape.thumbnailer.features.generatethumbnails.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.thumbnailer.features.generatethumbnails.domain.ThumbnailJob;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Wire form of a thumbnail job, shared by the HTTP endpoints and the queue listener.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ThumbnailJobRequest(
    @NotBlank(message = "srcImage is required")
    @JsonProperty("srcImage") String srcImage,

    @NotBlank(message = "dstFolder is required")
    @JsonProperty("dstFolder") String dstFolder,

    @JsonProperty("deleteSrc") boolean deleteSrc,

    @Valid
    @JsonProperty("opts") List<ThumbnailOptionRequest> opts
) {

    public ThumbnailJob toJob() {
        List<ThumbnailOptionRequest> options = opts == null ? List.of() : opts;
        return new ThumbnailJob(
                srcImage,
                dstFolder,
                deleteSrc,
                options.stream().map(ThumbnailOptionRequest::toOption).toList());
    }
}
