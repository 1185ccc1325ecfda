package com.example.musictracker.domain.model;

import java.nio.file.Path;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A file offered to the importer together with the digest of its bytes.
 */
@Data
@AllArgsConstructor
public class MediaFile {

    private String contentPath;

    private Path filePath;

    private String contentType;

    private long size;

    private long lastModifiedMillis;

    private byte[] contentDigest;
}
