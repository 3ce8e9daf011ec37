package com.deepansh.historyagent.history;

import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Query service over a fully loaded, immutable list of plays.
 *
 * Listening histories are small enough (a few hundred thousand rows at most)
 * that a linear scan per query is fine; no indexes are kept.
 */
@Slf4j
public class InMemoryListeningHistory implements ListeningHistoryQueryService {

    private static final long MS_PER_MINUTE = 60_000L;

    private final List<ListeningRecord> records;

    public InMemoryListeningHistory(List<ListeningRecord> records) {
        this.records = List.copyOf(records);
        log.info("Listening history ready: {} plays", this.records.size());
    }

    @Override
    public SummaryStats summaryStats(DateRange range) {
        List<ListeningRecord> inRange = filter(range, null);
        if (inRange.isEmpty()) {
            return SummaryStats.empty();
        }

        long totalMs = inRange.stream().mapToLong(ListeningRecord::getMsPlayed).sum();
        LocalDate first = inRange.stream().map(r -> r.getPlayedAt().toLocalDate())
                .min(Comparator.naturalOrder()).orElse(null);
        LocalDate last = inRange.stream().map(r -> r.getPlayedAt().toLocalDate())
                .max(Comparator.naturalOrder()).orElse(null);
        long uniqueTracks = inRange.stream().map(r -> r.getArtist() + "\u0000" + r.getTrack()).distinct().count();
        long uniqueArtists = inRange.stream().map(ListeningRecord::getArtist).distinct().count();

        return new SummaryStats(inRange.size(), totalMs / MS_PER_MINUTE, first, last, uniqueTracks, uniqueArtists);
    }

    @Override
    public List<EntityRanking> topEntities(EntityType type, int n, DateRange range, String artist) {
        Function<ListeningRecord, Key> keyFn = switch (type) {
            case ARTIST -> r -> new Key(r.getArtist(), null);
            case TRACK -> r -> new Key(r.getTrack(), r.getArtist());
            case ALBUM -> r -> new Key(r.getAlbum(), r.getArtist());
        };

        Map<Key, long[]> totals = new HashMap<>();
        filter(range, artist).stream()
                .filter(r -> keyFn.apply(r).name() != null)
                .forEach(r -> {
                    long[] t = totals.computeIfAbsent(keyFn.apply(r), k -> new long[2]);
                    t[0] += r.getMsPlayed();
                    t[1]++;
                });

        List<Map.Entry<Key, long[]>> sorted = totals.entrySet().stream()
                .sorted(Comparator.<Map.Entry<Key, long[]>>comparingLong(e -> e.getValue()[0]).reversed()
                        .thenComparing(Comparator.<Map.Entry<Key, long[]>>comparingLong(e -> e.getValue()[1]).reversed())
                        .thenComparing(e -> e.getKey().name()))
                .limit(Math.max(0, n))
                .toList();

        return IntStream.range(0, sorted.size())
                .mapToObj(i -> {
                    Map.Entry<Key, long[]> e = sorted.get(i);
                    return new EntityRanking(i + 1, e.getKey().name(), e.getKey().artist(),
                            e.getValue()[1], e.getValue()[0] / MS_PER_MINUTE);
                })
                .toList();
    }

    @Override
    public List<TrendPoint> listeningTrend(TimeBucket bucket, DateRange range) {
        // hour and weekday are cyclic and stay in clock order; month and year run newest first
        Map<Integer, long[]> totals = bucket.isChronological()
                ? new TreeMap<>(Comparator.reverseOrder())
                : new TreeMap<>();
        filter(range, null).forEach(r -> {
            int key = switch (bucket) {
                case HOUR -> r.getPlayedAt().getHour();
                case WEEKDAY -> r.getPlayedAt().getDayOfWeek().getValue();
                case MONTH -> r.getPlayedAt().getYear() * 100 + r.getPlayedAt().getMonthValue();
                case YEAR -> r.getPlayedAt().getYear();
            };
            long[] t = totals.computeIfAbsent(key, k -> new long[2]);
            t[0]++;
            t[1] += r.getMsPlayed();
        });

        Map<String, TrendPoint> points = new LinkedHashMap<>();
        totals.forEach((key, t) -> {
            String label = label(bucket, key);
            points.put(label, new TrendPoint(label, t[0], t[1] / MS_PER_MINUTE));
        });
        return List.copyOf(points.values());
    }

    @Override
    public List<ListeningRecord> playsInRange(DateRange range, String artist, int limit) {
        return filter(range, artist).stream()
                .sorted(Comparator.comparing(ListeningRecord::getPlayedAt).reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    private List<ListeningRecord> filter(DateRange range, String artist) {
        DateRange effective = range != null ? range : DateRange.ALL;
        return records.stream()
                .filter(r -> effective.contains(r.getPlayedAt().toLocalDate()))
                .filter(r -> artist == null || artist.isBlank()
                        || artist.equalsIgnoreCase(Objects.requireNonNullElse(r.getArtist(), "")))
                .toList();
    }

    private String label(TimeBucket bucket, int key) {
        return switch (bucket) {
            case HOUR -> String.format("%02d:00", key);
            case WEEKDAY -> DayOfWeek.of(key).getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
            case MONTH -> YearMonth.of(key / 100, key % 100).toString();
            case YEAR -> String.valueOf(key);
        };
    }

    private record Key(String name, String artist) {}
}
