package com.ytarchive.collaborator;

import java.time.OffsetDateTime;
import java.util.List;

public record VideoMetadata(
        String videoId,
        String title,
        String channel,
        long durationSeconds,
        OffsetDateTime publishedAt,
        List<String> availableCaptionLanguages) {
}
