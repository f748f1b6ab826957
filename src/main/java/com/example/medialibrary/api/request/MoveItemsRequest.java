package com.example.medialibrary.api.request;

import java.util.List;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MoveItemsRequest {

    @NotEmpty
    private List<Integer> draggedIndices;

    @NotNull
    @Min(0)
    private Integer dropIndex;
}
