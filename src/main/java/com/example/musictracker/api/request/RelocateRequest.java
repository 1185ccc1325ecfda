package com.example.musictracker.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RelocateRequest {

    @NotBlank
    private String collectionUid;

    @NotNull
    private String oldPrefix;

    @NotNull
    private String newPrefix;
}
