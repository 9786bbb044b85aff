package com.ytarchive.collaborator;

public record DownloadResult(String videoId, String filePath, long fileSize) {
}
