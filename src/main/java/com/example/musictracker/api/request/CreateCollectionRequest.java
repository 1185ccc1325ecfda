package com.example.musictracker.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateCollectionRequest {

    @NotBlank
    @Size(max = 64)
    private String uid;

    @Size(max = 255)
    private String title;

    @NotBlank
    private String rootUrl;
}
