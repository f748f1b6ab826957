package com.example.medialibrary.api.request;

import java.util.List;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.Size;
import lombok.Data;

/**
 * Media references in their string form, {@code track:<filename>} or {@code video:<id>}.
 */
@Data
public class MediaRefsRequest {

    @NotEmpty
    @Size(max = 5000)
    private List<String> refs;
}
