package com.example.musictracker.infrastructure.importer;

import com.example.musictracker.common.util.ContentPaths;
import com.example.musictracker.domain.model.ImportResult;
import com.example.musictracker.domain.model.ImportTrackConfig;
import com.example.musictracker.domain.model.MediaFile;
import com.example.musictracker.domain.model.MediaSource;
import com.example.musictracker.domain.model.Track;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.images.Artwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerTrackImporter implements TrackImporter {

    private static final Logger log = LoggerFactory.getLogger(JaudiotaggerTrackImporter.class);

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");
    private static final Pattern TRACK_NO_PREFIX_PATTERN = Pattern.compile("^\\d{1,3}\\s*[-._)]\\s*");

    @Override
    public ImportResult importTrack(MediaFile file, Track existing, ImportTrackConfig config) {
        AudioFile parsed;
        try {
            parsed = AudioFileIO.read(file.getFilePath().toFile());
        } catch (Exception e) {
            log.debug("Tag parsing failed path={}", file.getContentPath(), e);
            return ImportResult.failed(Collections.singletonList(
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
        List<String> issues = new ArrayList<>();
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();
        if (tag == null) {
            issues.add("No tag found");
        }

        Track track = existing == null ? new Track() : existing.copy();
        track.setTitle(safeTagValue(tag, FieldKey.TITLE, issues));
        track.setArtist(safeTagValue(tag, FieldKey.ARTIST, issues));
        track.setAlbum(safeTagValue(tag, FieldKey.ALBUM, issues));
        track.setAlbumArtist(safeTagValue(tag, FieldKey.ALBUM_ARTIST, issues));
        track.setComposer(safeTagValue(tag, FieldKey.COMPOSER, issues));
        track.setTrackNo(parseInteger(safeTagValue(tag, FieldKey.TRACK, issues)));
        track.setDiscNo(parseInteger(safeTagValue(tag, FieldKey.DISC_NO, issues)));
        track.setYear(parseInteger(safeTagValue(tag, FieldKey.YEAR, issues)));
        track.setGenre(safeTagValue(tag, FieldKey.GENRE, issues));
        track.setComment(safeTagValue(tag, FieldKey.COMMENT, issues));
        track.setBpm(parseInteger(safeTagValue(tag, FieldKey.BPM, issues)));
        track.setMusicalKey(safeTagValue(tag, FieldKey.KEY, issues));
        if (track.getTitle() == null && config.isFallbackTitleFromFileName()) {
            track.setTitle(titleFromFileName(file.getContentPath()));
            issues.add("Missing title, derived from file name");
        }

        MediaSource source = new MediaSource();
        source.setContentType(file.getContentType());
        if (header != null) {
            source.setDurationMs(header.getTrackLength() * 1000);
            source.setBitrate(parseInteger(header.getBitRate()));
            source.setSampleRate(parseInteger(header.getSampleRate()));
            source.setChannels(parseInteger(header.getChannels()));
        } else {
            issues.add("No audio header found");
        }
        source.setHasArtwork(false);
        if (config.isIncludeArtwork() && tag != null) {
            Artwork artwork = tag.getFirstArtwork();
            if (artwork != null) {
                source.setHasArtwork(true);
                source.setArtworkMimeType(artwork.getMimeType());
            }
        }
        return ImportResult.imported(track, source, issues);
    }

    static String titleFromFileName(String contentPath) {
        String name = ContentPaths.fileName(contentPath);
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        String stripped = TRACK_NO_PREFIX_PATTERN.matcher(name).replaceFirst("").trim();
        return stripped.isEmpty() ? name.trim() : stripped;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey, List<String> issues) {
        if (tag == null) {
            return null;
        }
        String value;
        try {
            value = tag.getFirst(fieldKey);
        } catch (RuntimeException e) {
            issues.add("Unreadable field " + fieldKey + ": " + e.getMessage());
            return null;
        }
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Integer parseInteger(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
