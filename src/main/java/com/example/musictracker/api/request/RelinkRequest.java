package com.example.musictracker.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RelinkRequest {

    @NotBlank
    private String collectionUid;

    /**
     * Path the track was imported from, usually no longer backed by a file.
     */
    @NotBlank
    private String oldContentPath;

    /**
     * Path the file was moved to, already imported as a separate track.
     */
    @NotBlank
    private String newContentPath;
}
