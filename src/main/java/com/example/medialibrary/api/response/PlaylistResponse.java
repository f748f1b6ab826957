package com.example.medialibrary.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistResponse {

    private Long id;
    private String name;
    private int itemCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
