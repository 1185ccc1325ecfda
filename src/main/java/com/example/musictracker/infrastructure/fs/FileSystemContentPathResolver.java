package com.example.musictracker.infrastructure.fs;

import com.example.musictracker.common.exception.BusinessException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves content paths against a local {@code file:} root directory.
 */
public class FileSystemContentPathResolver implements ContentPathResolver {

    private static final String FILE_SCHEME = "file";

    private final Path rootDirectory;
    private final URI rootLocation;
    private final String rootUriPath;

    public FileSystemContentPathResolver(Path rootDirectory) {
        this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
        URI uri = this.rootDirectory.toUri();
        String text = uri.toString();
        this.rootLocation = text.endsWith("/") ? uri : URI.create(text + "/");
        this.rootUriPath = rootLocation.getPath();
    }

    public static FileSystemContentPathResolver forRootUrl(String rootUrl) {
        if (rootUrl == null || rootUrl.trim().isEmpty()) {
            throw new BusinessException("400", "Collection root URL is missing");
        }
        URI uri;
        try {
            uri = new URI(rootUrl.trim());
        } catch (URISyntaxException e) {
            throw new BusinessException("400", "Malformed root URL: " + rootUrl);
        }
        requireFileScheme(uri);
        return new FileSystemContentPathResolver(Paths.get(uri));
    }

    private static void requireFileScheme(URI uri) {
        if (uri.getScheme() == null || !FILE_SCHEME.equalsIgnoreCase(uri.getScheme())) {
            throw new BusinessException("400", "Unsupported URL scheme: " + uri.getScheme());
        }
    }

    @Override
    public URI getRootLocation() {
        return rootLocation;
    }

    @Override
    public URI pathToLocation(String contentPath) {
        if (contentPath == null || contentPath.isEmpty()) {
            return rootLocation;
        }
        try {
            URI relative = new URI(null, null, "./" + contentPath, null);
            return rootLocation.resolve(relative);
        } catch (URISyntaxException e) {
            throw new BusinessException("400", "Invalid content path: " + contentPath);
        }
    }

    @Override
    public String locationToPath(URI location) {
        if (location == null) {
            throw new BusinessException("400", "Location is missing");
        }
        requireFileScheme(location);
        String path = location.normalize().getPath();
        if (path == null) {
            throw new BusinessException("400", "Location has no path: " + location);
        }
        if (path.equals(rootUriPath) || (path + "/").equals(rootUriPath)) {
            return "";
        }
        if (!path.startsWith(rootUriPath)) {
            throw new BusinessException("400", "Location " + location + " is outside of root " + rootLocation);
        }
        return path.substring(rootUriPath.length());
    }

    @Override
    public Path toFilePath(String contentPath) {
        if (contentPath == null || contentPath.isEmpty()) {
            return rootDirectory;
        }
        return rootDirectory.resolve(contentPath).normalize();
    }
}
