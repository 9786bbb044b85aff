package com.ytarchive.collaborator;

/**
 * One video of a playlist. Unavailable entries (private, deleted) are listed by YouTube but cannot
 * be downloaded.
 */
public record PlaylistEntry(String videoId, String title, int position, boolean available, String unavailableReason) {

    public static PlaylistEntry available(String videoId, String title, int position) {
        return new PlaylistEntry(videoId, title, position, true, null);
    }

    public static PlaylistEntry unavailable(String videoId, int position, String reason) {
        return new PlaylistEntry(videoId, null, position, false, reason);
    }
}
