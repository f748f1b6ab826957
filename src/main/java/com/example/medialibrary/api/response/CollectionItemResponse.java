package com.example.medialibrary.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionItemResponse {

    private Long entryId;
    private int position;
    private LocalDateTime addedAt;
    private MediaItemResponse item;
}
