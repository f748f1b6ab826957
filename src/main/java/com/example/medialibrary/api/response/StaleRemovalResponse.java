package com.example.medialibrary.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StaleRemovalResponse {

    private int requested;
    private int deleted;
    private List<String> ignored;
}
