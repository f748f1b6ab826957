package com.example.medialibrary.api.request;

import java.util.List;
import javax.validation.constraints.NotNull;
import lombok.Data;

/**
 * The complete new order as media references; an empty list only matches an empty collection.
 */
@Data
public class ReorderItemsRequest {

    @NotNull
    private List<String> refs;
}
