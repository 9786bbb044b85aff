package com.ytarchive.collaborator;

import com.ytarchive.PlaylistReport;

/**
 * Client of the storage service that owns the archive layout.
 */
public interface ArchiveStorage {

    boolean videoExists(String videoId) throws Exception;

    String storagePathFor(String videoId, String outputDir) throws Exception;

    void recordVideoSaved(String videoId, DownloadResult download) throws Exception;

    void saveMetadata(VideoMetadata metadata) throws Exception;

    void savePlaylistReport(PlaylistReport report) throws Exception;
}
