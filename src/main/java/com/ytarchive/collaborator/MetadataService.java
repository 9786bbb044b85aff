package com.ytarchive.collaborator;

/**
 * Client of the metadata service. Failures surface as exceptions, typically
 * {@link com.ytarchive.recovery.CollaboratorException} carrying the HTTP status.
 */
public interface MetadataService {

    VideoMetadata fetchVideo(String videoId) throws Exception;

    PlaylistMetadata fetchPlaylist(String playlistId) throws Exception;
}
