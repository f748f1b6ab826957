package com.example.medialibrary.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanEventsResponse {

    private Long sessionId;
    private String status;
    private List<ScanEventResponse> events;
    private boolean finished;
}
