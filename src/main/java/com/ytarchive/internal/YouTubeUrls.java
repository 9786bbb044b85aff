package com.ytarchive.internal;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts video and playlist ids from YouTube URLs.
 */
public final class YouTubeUrls {

    private static final Pattern WATCH = Pattern.compile("youtube\\.com/watch\\?(?:.*&)?v=([A-Za-z0-9_-]+)");
    private static final Pattern SHORT = Pattern.compile("youtu\\.be/([A-Za-z0-9_-]+)");
    private static final Pattern SHORTS = Pattern.compile("youtube\\.com/shorts/([A-Za-z0-9_-]+)");
    private static final Pattern PLAYLIST = Pattern.compile("youtube\\.com/(?:playlist|watch)\\?(?:.*&)?list=([A-Za-z0-9_-]+)");
    private static final Pattern BARE_VIDEO_ID = Pattern.compile("[A-Za-z0-9_-]{11}");

    private YouTubeUrls() {
    }

    /**
     * @return the video id, or {@code null} if the URL does not name a video
     */
    public static String videoId(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        if (BARE_VIDEO_ID.matcher(trimmed).matches()) {
            return trimmed;
        }
        for (Pattern pattern : new Pattern[] {WATCH, SHORT, SHORTS}) {
            Matcher matcher = pattern.matcher(trimmed);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    /**
     * @return the playlist id, or {@code null} if the URL does not name a playlist
     */
    public static String playlistId(String url) {
        if (url == null) {
            return null;
        }
        Matcher matcher = PLAYLIST.matcher(url.trim());
        return matcher.find() ? matcher.group(1) : null;
    }

    public static String watchUrl(String videoId) {
        return "https://www.youtube.com/watch?v=" + videoId;
    }
}
