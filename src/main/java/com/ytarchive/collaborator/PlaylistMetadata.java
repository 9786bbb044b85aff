package com.ytarchive.collaborator;

import java.util.List;

public record PlaylistMetadata(String playlistId, String title, List<PlaylistEntry> entries) {

    public PlaylistMetadata {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
