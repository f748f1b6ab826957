package com.example.medialibrary.api.response;

import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanSessionResponse {

    private Long sessionId;
    private String status;
    private List<String> roots;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private int found;
    private int skipped;
    private int added;
    private int updated;
    private List<String> staleFiles;
    private int pendingEvents;
    private String errorSummary;
}
