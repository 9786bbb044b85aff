package com.ytarchive;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of one playlist URL of a playlist job. A playlist that could not be expanded carries an
 * error and no video counts.
 */
public record PlaylistSummary(
        String url,
        String playlistId,
        String title,
        int totalVideos,
        int successfulDownloads,
        int failedDownloads,
        int skipped,
        String error) {

    public static PlaylistSummary failed(String url, String playlistId, String error) {
        return new PlaylistSummary(url, playlistId, null, 0, 0, 0, 0, error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
