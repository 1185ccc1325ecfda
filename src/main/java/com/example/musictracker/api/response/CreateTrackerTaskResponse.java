package com.example.musictracker.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateTrackerTaskResponse {

    private Long taskId;

    private String status;
}
