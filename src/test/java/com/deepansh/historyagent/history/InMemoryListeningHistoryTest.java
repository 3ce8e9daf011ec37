package com.deepansh.historyagent.history;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.deepansh.historyagent.TestFixtures.play;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryListeningHistoryTest {

    private InMemoryListeningHistory history;

    @BeforeEach
    void setUp() {
        history = new InMemoryListeningHistory(List.of(
                play("2024-12-31T23:00", "Radiohead", "Reckoner", "In Rainbows", 5),
                play("2025-01-10T08:15", "Radiohead", "Nude", "In Rainbows", 4),
                play("2025-03-02T21:40", "Bjork", "Joga", "Homogenic", 6),
                play("2025-03-03T21:10", "Bjork", "Joga", "Homogenic", 6),
                play("2025-07-20T08:05", "Radiohead", "Reckoner", "In Rainbows", 5),
                play("2025-07-21T12:00", "Portishead", "Roads", "Dummy", 3)));
    }

    @Test
    void summaryStats_restrictsToRange() {
        SummaryStats stats = history.summaryStats(
                new DateRange(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 12, 31)));

        assertThat(stats.totalRecords()).isEqualTo(5);
        assertThat(stats.totalListeningMinutes()).isEqualTo(24);
        assertThat(stats.uniqueTracks()).isEqualTo(4);
        assertThat(stats.uniqueArtists()).isEqualTo(3);
        assertThat(stats.firstDate()).isEqualTo(LocalDate.of(2025, 1, 10));
        assertThat(stats.lastDate()).isEqualTo(LocalDate.of(2025, 7, 21));
    }

    @Test
    void summaryStats_emptyRange_returnsZeroes() {
        SummaryStats stats = history.summaryStats(
                new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 1, 31)));
        assertThat(stats).isEqualTo(SummaryStats.empty());
    }

    @Test
    void topEntities_ranksArtistsByMinutes() {
        List<EntityRanking> top = history.topEntities(EntityType.ARTIST, 2, DateRange.ALL, null);

        assertThat(top).extracting(EntityRanking::name).containsExactly("Radiohead", "Bjork");
        assertThat(top.get(0).rank()).isEqualTo(1);
        assertThat(top.get(0).playCount()).isEqualTo(3);
        assertThat(top.get(0).minutesPlayed()).isEqualTo(14);
        assertThat(top.get(0).artist()).isNull();
    }

    @Test
    void topEntities_tracksCarryTheirArtist() {
        List<EntityRanking> top = history.topEntities(EntityType.TRACK, 1, DateRange.ALL, null);

        assertThat(top).singleElement().satisfies(r -> {
            assertThat(r.name()).isEqualTo("Joga");
            assertThat(r.artist()).isEqualTo("Bjork");
        });
    }

    @Test
    void topEntities_artistFilter_ranksOnlyThatArtistsTracks() {
        List<EntityRanking> top = history.topEntities(EntityType.TRACK, 5, DateRange.ALL, "radiohead");

        assertThat(top).extracting(EntityRanking::name).containsExactly("Reckoner", "Nude");
        assertThat(top).extracting(EntityRanking::artist).containsOnly("Radiohead");
        assertThat(top.get(0).playCount()).isEqualTo(2);
    }

    @Test
    void topEntities_blankArtist_isIgnored() {
        assertThat(history.topEntities(EntityType.ALBUM, 5, DateRange.ALL, " "))
                .extracting(EntityRanking::name).containsExactly("In Rainbows", "Homogenic", "Dummy");
    }

    @Test
    void listeningTrend_byHour_isInClockOrder() {
        List<TrendPoint> trend = history.listeningTrend(TimeBucket.HOUR, DateRange.ALL);

        assertThat(trend).extracting(TrendPoint::bucket).containsExactly("08:00", "12:00", "21:00", "23:00");
        assertThat(trend.get(0).plays()).isEqualTo(2);
    }

    @Test
    void listeningTrend_byMonth_newestFirst() {
        List<TrendPoint> trend = history.listeningTrend(TimeBucket.MONTH, DateRange.ALL);

        assertThat(trend).extracting(TrendPoint::bucket)
                .containsExactly("2025-07", "2025-03", "2025-01", "2024-12");
        assertThat(trend.get(0).plays()).isEqualTo(2);
    }

    @Test
    void listeningTrend_byYear_newestFirst() {
        List<TrendPoint> trend = history.listeningTrend(TimeBucket.YEAR, DateRange.ALL);

        assertThat(trend).extracting(TrendPoint::bucket).containsExactly("2025", "2024");
        assertThat(trend.get(0).plays()).isEqualTo(5);
    }

    @Test
    void playsInRange_filtersArtistCaseInsensitively_mostRecentFirst() {
        List<ListeningRecord> plays = history.playsInRange(DateRange.ALL, "radiohead", 10);

        assertThat(plays).extracting(ListeningRecord::getTrack).containsExactly("Reckoner", "Nude", "Reckoner");
        assertThat(plays.get(0).getPlayedAt().getYear()).isEqualTo(2025);
    }

    @Test
    void playsInRange_respectsLimit() {
        assertThat(history.playsInRange(DateRange.ALL, null, 2)).hasSize(2);
    }
}
