package com.example.medialibrary.api.request;

import java.util.List;
import lombok.Data;

@Data
public class StartScanRequest {

    /**
     * Roots to scan; empty means every configured library folder.
     */
    private List<String> roots;
}
