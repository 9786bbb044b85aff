package com.ytarchive;

public enum JobType {
    VIDEO_DOWNLOAD,
    PLAYLIST_DOWNLOAD,
    METADATA_ONLY
}
