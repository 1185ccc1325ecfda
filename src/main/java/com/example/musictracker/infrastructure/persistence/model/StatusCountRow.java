package com.example.musictracker.infrastructure.persistence.model;

import lombok.Data;

@Data
public class StatusCountRow {

    private Integer status;
    private Long cnt;
}
