package com.example.musictracker.infrastructure.fs;

import com.example.musictracker.common.util.HashUtil;
import com.example.musictracker.domain.model.DirectoryEntry;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Digest of a directory's immediate listing.
 *
 * <p>Covers name, kind, size and modification time of every entry, never file contents. Subdirectories
 * contribute only their own entry, so a change deep in the tree is detected by the directory that
 * contains it and not by its ancestors.
 */
@Component
public class DirectoryDigestCalculator {

    private static final byte KIND_FILE = 1;
    private static final byte KIND_DIRECTORY = 2;

    public byte[] digest(List<DirectoryEntry> entries) {
        List<DirectoryEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(DirectoryEntry::getName));
        MessageDigest messageDigest = HashUtil.newDigest();
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + 1 + Long.BYTES * 2);
        for (DirectoryEntry entry : sorted) {
            byte[] name = entry.getName().getBytes(StandardCharsets.UTF_8);
            buffer.clear();
            buffer.putInt(name.length);
            buffer.put(entry.isDirectory() ? KIND_DIRECTORY : KIND_FILE);
            buffer.putLong(entry.getSize());
            buffer.putLong(entry.getLastModifiedMillis());
            messageDigest.update(name);
            messageDigest.update(buffer.array(), 0, buffer.position());
        }
        return messageDigest.digest();
    }
}
