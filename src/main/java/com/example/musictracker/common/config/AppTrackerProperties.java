package com.example.musictracker.common.config;

import com.example.musictracker.domain.enumtype.SyncMode;
import com.example.musictracker.domain.enumtype.TrackerTaskType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.tracker")
public class AppTrackerProperties {

    /**
     * Directories committed per scan transaction.
     */
    private int scanBatchSize = 1;

    /**
     * Imported files committed per import transaction.
     */
    private int importBatchSize = 50;

    /**
     * Pending directories loaded per query during an import pass.
     */
    private int pendingPageSize = 1;

    private List<String> audioExtensions = new ArrayList<>(Arrays.asList("mp3", "flac", "m4a", "aac", "ogg", "wav"));

    /**
     * Ignore dot-prefixed entries when listing and digesting directories.
     */
    private boolean skipHiddenEntries = true;

    private SyncMode defaultSyncMode = SyncMode.MODIFIED;

    private int taskThreadCount = 2;

    private int taskQueueSize = 20;

    /**
     * Whether the scheduled scan and import of every collection is active.
     */
    private boolean rescanEnabled = false;

    private String rescanCron = "0 0 3 * * ?";

    private TrackerTaskType rescanTaskType = TrackerTaskType.SCAN_AND_IMPORT;

    private int progressLogIntervalSec = 30;

    private int progressLogIntervalEvents = 100;

    public Set<String> normalizedAudioExtensions() {
        return audioExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
