package com.example.medialibrary.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    /**
     * Library roots, scanned in this order.
     */
    private List<String> folders = new ArrayList<>();

    /**
     * Start one background scan over all folders once the application is ready.
     */
    private boolean rescanOnStartup = false;

    private List<String> audioExtensions = new ArrayList<>(Arrays.asList(
            "mp3", "flac", "ogg", "opus", "wav", "aac", "m4a", "wma",
            "aiff", "aif", "ape", "wv", "mpc", "mp4", "webm"));

    /**
     * Max stale filenames echoed in the scan finish log line.
     */
    private int staleLogPreviewLimit = 10;

    public Set<String> normalizedAudioExtensions() {
        return audioExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
