package com.deepansh.historyagent.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads streaming-history JSON exports into {@link ListeningRecord}s.
 *
 * Two export formats are understood:
 * - extended history: ts, ms_played, master_metadata_track_name,
 *   master_metadata_album_artist_name, master_metadata_album_album_name, skipped
 * - account-data history: endTime ("yyyy-MM-dd HH:mm", UTC), artistName, trackName, msPlayed
 *
 * Podcast and audiobook rows (no track name) are skipped. A file that cannot be parsed
 * is logged and skipped so one corrupt export never hides the rest.
 */
@Slf4j
public class ListeningHistoryLoader {

    private static final DateTimeFormatter LEGACY_END_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ObjectMapper objectMapper;
    private final ZoneId zone;

    public ListeningHistoryLoader(ObjectMapper objectMapper, ZoneId zone) {
        this.objectMapper = objectMapper;
        this.zone = zone;
    }

    public List<ListeningRecord> load(Path directory, String filePattern) {
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Listening history directory not found: {}, starting with an empty history", directory);
            return List.of();
        }

        List<ListeningRecord> records = new ArrayList<>();
        int files = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, filePattern)) {
            for (Path file : stream) {
                files++;
                records.addAll(loadFile(file));
            }
        } catch (IOException e) {
            log.error("Failed to list listening history files in {}", directory, e);
        }

        log.info("Loaded {} plays from {} file(s) matching '{}' in {}", records.size(), files, filePattern, directory);
        return records;
    }

    List<ListeningRecord> loadFile(Path file) {
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (!root.isArray()) {
                log.warn("Skipping {}: expected a JSON array", file.getFileName());
                return List.of();
            }

            List<ListeningRecord> records = new ArrayList<>();
            int skipped = 0;
            for (JsonNode node : root) {
                ListeningRecord record = toRecord(node);
                if (record == null) {
                    skipped++;
                } else {
                    records.add(record);
                }
            }
            log.debug("Loaded {}: {} plays, {} rows skipped", file.getFileName(), records.size(), skipped);
            return records;

        } catch (IOException e) {
            log.error("Failed to load {}: {}", file.getFileName(), e.getMessage());
            return List.of();
        }
    }

    ListeningRecord toRecord(JsonNode node) {
        try {
            if (node.hasNonNull("ts")) {
                String track = text(node, "master_metadata_track_name");
                if (track == null) return null;
                return ListeningRecord.builder()
                        .playedAt(LocalDateTime.ofInstant(Instant.parse(node.get("ts").asText()), zone))
                        .track(track)
                        .artist(text(node, "master_metadata_album_artist_name"))
                        .album(text(node, "master_metadata_album_album_name"))
                        .msPlayed(node.path("ms_played").asLong())
                        .skipped(node.path("skipped").asBoolean(false))
                        .build();
            }
            if (node.hasNonNull("endTime")) {
                String track = text(node, "trackName");
                if (track == null) return null;
                LocalDateTime utc = LocalDateTime.parse(node.get("endTime").asText(), LEGACY_END_TIME);
                return ListeningRecord.builder()
                        .playedAt(utc.atZone(ZoneId.of("UTC")).withZoneSameInstant(zone).toLocalDateTime())
                        .track(track)
                        .artist(text(node, "artistName"))
                        .msPlayed(node.path("msPlayed").asLong())
                        .build();
            }
        } catch (DateTimeParseException e) {
            log.debug("Skipping row with unparseable timestamp: {}", e.getParsedString());
        }
        return null;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String s = value.asText();
        return s.isBlank() ? null : s;
    }
}
