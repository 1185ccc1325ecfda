package com.example.musictracker.infrastructure.fs;

import java.net.URI;
import java.nio.file.Path;

/**
 * Maps collection-relative content paths to absolute locations and back.
 */
public interface ContentPathResolver {

    URI getRootLocation();

    URI pathToLocation(String contentPath);

    /**
     * @throws com.example.musictracker.common.exception.BusinessException if the scheme is not supported
     *                                                                    or the location lies outside the root
     */
    String locationToPath(URI location);

    Path toFilePath(String contentPath);
}
