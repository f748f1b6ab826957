package com.example.medialibrary.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MediaRefRequest {

    @NotBlank
    private String ref;

    /**
     * {@code false} only stamps last played without counting a play.
     */
    private Boolean countPlay = Boolean.TRUE;
}
