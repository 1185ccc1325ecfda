package com.example.musictracker.infrastructure.fs;

import com.example.musictracker.common.config.AppTrackerProperties;
import com.example.musictracker.domain.model.DirectoryEntry;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lists the immediate children of a directory with the attributes used for change detection.
 */
@Component
public class DirectoryLister {

    private static final Logger log = LoggerFactory.getLogger(DirectoryLister.class);

    private final boolean skipHiddenEntries;

    public DirectoryLister(AppTrackerProperties appTrackerProperties) {
        this.skipHiddenEntries = appTrackerProperties.isSkipHiddenEntries();
    }

    /**
     * Entries sorted by name. Entries whose attributes cannot be read are left out and logged.
     *
     * @throws IOException if the directory itself cannot be opened
     */
    public List<DirectoryEntry> list(Path directory) throws IOException {
        List<DirectoryEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                String name = child.getFileName().toString();
                if (skipHiddenEntries && name.startsWith(".")) {
                    continue;
                }
                try {
                    BasicFileAttributes attributes = Files.readAttributes(
                            child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                    if (!attributes.isDirectory() && !attributes.isRegularFile()) {
                        continue;
                    }
                    entries.add(new DirectoryEntry(
                            name,
                            attributes.isDirectory(),
                            attributes.isDirectory() ? 0L : attributes.size(),
                            attributes.lastModifiedTime().toMillis()));
                } catch (IOException e) {
                    log.warn("Skipping unreadable entry path={} reason={}", child, e.getMessage());
                }
            }
        }
        entries.sort(Comparator.comparing(DirectoryEntry::getName));
        return entries;
    }
}
