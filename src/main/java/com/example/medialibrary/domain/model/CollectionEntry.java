package com.example.medialibrary.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CollectionEntry {

    private Long id;

    private CollectionScope scope;

    private int position;

    private MediaItemRef ref;

    private LocalDateTime addedAt;
}
