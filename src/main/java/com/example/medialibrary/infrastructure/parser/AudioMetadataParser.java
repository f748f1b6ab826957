package com.example.medialibrary.infrastructure.parser;

import com.example.medialibrary.domain.model.AudioMetadata;
import java.io.File;

public interface AudioMetadataParser {

    /**
     * Reads tags and duration. Fields the file does not carry are left {@code null}.
     */
    AudioMetadata parse(File audioFile) throws Exception;

    /**
     * Reads only the audio header; used to back-fill rows cataloged without a duration.
     */
    Integer parseDuration(File audioFile) throws Exception;
}
