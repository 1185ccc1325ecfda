package com.example.musictracker.application.service;

import com.example.musictracker.domain.model.DirectoriesStatus;
import com.example.musictracker.domain.repository.MediaTrackerRepository;
import org.springframework.stereotype.Service;

/**
 * Read-only status queries; these never wait for the write lease.
 */
@Service
public class TrackerStatusService {

    private final MediaTrackerRepository repository;

    public TrackerStatusService(MediaTrackerRepository repository) {
        this.repository = repository;
    }

    public DirectoriesStatus directoriesStatus(TrackerContext context) {
        return repository.aggregateStatus(context.getCollectionId(), context.getRootPath());
    }
}
