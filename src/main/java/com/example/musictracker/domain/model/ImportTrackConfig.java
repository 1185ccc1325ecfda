package com.example.musictracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportTrackConfig {

    /**
     * Derive a title from the file name when the tags carry none.
     */
    private boolean fallbackTitleFromFileName = true;

    /**
     * Look for embedded artwork.
     */
    private boolean includeArtwork = true;

    public static ImportTrackConfig defaults() {
        return new ImportTrackConfig();
    }
}
