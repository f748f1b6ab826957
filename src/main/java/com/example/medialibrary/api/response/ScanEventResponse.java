package com.example.medialibrary.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flattened progress event; fields that do not apply to {@link #type} are omitted.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanEventResponse {

    private String type;
    private String folder;
    private String path;
    private Integer found;
    private Integer skipped;
    private Integer added;
    private Integer updated;
    private List<String> staleFiles;
}
