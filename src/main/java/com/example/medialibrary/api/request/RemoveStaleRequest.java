package com.example.medialibrary.api.request;

import java.util.List;
import lombok.Data;

@Data
public class RemoveStaleRequest {

    /**
     * Confirmed stale filenames; empty confirms the whole stale set of the last scan.
     */
    private List<String> filenames;
}
