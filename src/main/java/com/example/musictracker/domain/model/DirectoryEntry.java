package com.example.musictracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One immediate child of a directory as seen by a listing, without its content.
 */
@Data
@AllArgsConstructor
public class DirectoryEntry {

    private String name;

    private boolean directory;

    private long size;

    private long lastModifiedMillis;
}
