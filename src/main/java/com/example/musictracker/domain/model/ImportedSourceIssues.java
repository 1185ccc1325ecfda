package com.example.musictracker.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ImportedSourceIssues {

    private final String path;
    private final List<String> messages;

    public ImportedSourceIssues(String path, List<String> messages) {
        this.path = path;
        this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public String getPath() {
        return path;
    }

    public List<String> getMessages() {
        return messages;
    }

    @Override
    public String toString() {
        return path + " " + messages;
    }
}
