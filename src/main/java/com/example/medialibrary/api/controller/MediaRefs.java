package com.example.medialibrary.api.controller;

import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.model.MediaItemRef;
import java.util.ArrayList;
import java.util.List;

final class MediaRefs {

    private MediaRefs() {
    }

    static MediaItemRef parse(String raw) {
        try {
            return MediaItemRef.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new BusinessException("400", e.getMessage(), "Use track:<filename> or video:<id>");
        }
    }

    static List<MediaItemRef> parseAll(List<String> raws) {
        List<MediaItemRef> refs = new ArrayList<>(raws.size());
        for (String raw : raws) {
            refs.add(parse(raw));
        }
        return refs;
    }
}
