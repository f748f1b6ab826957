package com.example.medialibrary.infrastructure.parser;

import com.example.medialibrary.domain.model.AudioMetadata;
import java.io.File;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.KeyNotFoundException;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioMetadataParser implements AudioMetadataParser {

    static {
        // jaudiotagger reports every odd frame at INFO/WARNING through java.util.logging
        Logger.getLogger("org.jaudiotagger").setLevel(Level.SEVERE);
    }

    @Override
    public AudioMetadata parse(File audioFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(audioFile);
        Integer durationSec = durationOf(parsed.getAudioHeader());
        Tag tag = parsed.getTag();
        if (tag == null) {
            return AudioMetadata.untagged(durationSec);
        }

        AudioMetadata metadata = new AudioMetadata();
        metadata.setTitle(safeTagValue(tag, FieldKey.TITLE));
        metadata.setArtist(safeTagValue(tag, FieldKey.ARTIST));
        metadata.setAlbum(safeTagValue(tag, FieldKey.ALBUM));
        metadata.setAlbumArtist(safeTagValue(tag, FieldKey.ALBUM_ARTIST));
        metadata.setTrackNumber(safeTagValue(tag, FieldKey.TRACK));
        metadata.setGenre(safeTagValue(tag, FieldKey.GENRE));
        metadata.setDurationSec(durationSec);
        return metadata;
    }

    @Override
    public Integer parseDuration(File audioFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(audioFile);
        return durationOf(parsed.getAudioHeader());
    }

    private Integer durationOf(AudioHeader header) {
        if (header == null) {
            return null;
        }
        int seconds = header.getTrackLength();
        return seconds < 0 ? null : seconds;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        String value;
        try {
            value = tag.getFirst(fieldKey);
        } catch (KeyNotFoundException | UnsupportedOperationException e) {
            return null;
        }
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
