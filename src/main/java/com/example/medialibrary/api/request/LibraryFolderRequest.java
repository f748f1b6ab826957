package com.example.medialibrary.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LibraryFolderRequest {

    @NotBlank
    private String folder;
}
