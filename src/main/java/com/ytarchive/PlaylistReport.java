package com.ytarchive;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Per-playlist breakdown of a finished playlist job, kept on the job and pushed to storage.
 */
public record PlaylistReport(
        UUID jobId,
        OffsetDateTime createdAt,
        int totalPlaylists,
        int successfulPlaylists,
        int failedPlaylists,
        int totalVideos,
        int successfulDownloads,
        int failedDownloads,
        double overallSuccessRate,
        List<PlaylistSummary> playlists) {

    public PlaylistReport {
        playlists = playlists == null ? List.of() : List.copyOf(playlists);
    }

    public static PlaylistReport of(UUID jobId, List<PlaylistSummary> playlists, OffsetDateTime createdAt) {
        int failedPlaylists = 0;
        int totalVideos = 0;
        int successful = 0;
        int failed = 0;
        for (PlaylistSummary playlist : playlists) {
            if (playlist.isFailed()) {
                failedPlaylists++;
            }
            totalVideos += playlist.totalVideos();
            successful += playlist.successfulDownloads();
            failed += playlist.failedDownloads();
        }
        return new PlaylistReport(jobId, createdAt, playlists.size(), playlists.size() - failedPlaylists,
                failedPlaylists, totalVideos, successful, failed, successRate(successful, totalVideos), playlists);
    }

    /**
     * Successful downloads as a percentage of all videos, rounded to two decimals; {@code 0} when
     * no playlist had videos.
     */
    static double successRate(int successful, int totalVideos) {
        if (totalVideos == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(successful * 100.0 / totalVideos).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
