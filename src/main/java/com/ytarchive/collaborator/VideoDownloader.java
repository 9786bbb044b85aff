package com.ytarchive.collaborator;

import com.ytarchive.JobOptions;

/**
 * Client of the download service. A call blocks until the file is complete; implementations should
 * stop promptly when the calling thread is interrupted.
 */
public interface VideoDownloader {

    DownloadResult download(String videoId, String storagePath, JobOptions options) throws Exception;
}
