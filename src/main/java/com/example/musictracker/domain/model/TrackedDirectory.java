package com.example.musictracker.domain.model;

import com.example.musictracker.domain.enumtype.DirTrackingStatus;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackedDirectory {

    private String path;

    private byte[] digest;

    private DirTrackingStatus status;

    private LocalDateTime updatedAt;

    public TrackedDirectory(String path, byte[] digest, DirTrackingStatus status) {
        this(path, digest, status, null);
    }
}
