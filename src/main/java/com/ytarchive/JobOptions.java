package com.ytarchive;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-job options. Unset concurrency and chunk size fall back to the batch defaults.
 */
public class JobOptions {

    private String outputDir;
    private String quality = "best";
    private boolean includeMetadata = true;
    private boolean includeCaptions = false;
    private List<String> captionLanguages = new ArrayList<>(List.of("en"));
    private boolean skipExisting = true;
    private Integer maxConcurrent;
    private Integer chunkSize;
    private ItemFailurePolicy itemFailurePolicy;

    public static JobOptions defaults() {
        return new JobOptions();
    }

    public ItemFailurePolicy resolveFailurePolicy(JobType type) {
        if (itemFailurePolicy != null) {
            return itemFailurePolicy;
        }
        return type == JobType.PLAYLIST_DOWNLOAD ? ItemFailurePolicy.BEST_EFFORT : ItemFailurePolicy.FAIL_JOB;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getQuality() {
        return quality;
    }

    public void setQuality(String quality) {
        this.quality = quality;
    }

    public boolean isIncludeMetadata() {
        return includeMetadata;
    }

    public void setIncludeMetadata(boolean includeMetadata) {
        this.includeMetadata = includeMetadata;
    }

    public boolean isIncludeCaptions() {
        return includeCaptions;
    }

    public void setIncludeCaptions(boolean includeCaptions) {
        this.includeCaptions = includeCaptions;
    }

    public List<String> getCaptionLanguages() {
        return captionLanguages;
    }

    public void setCaptionLanguages(List<String> captionLanguages) {
        this.captionLanguages = captionLanguages == null ? new ArrayList<>() : new ArrayList<>(captionLanguages);
    }

    public boolean isSkipExisting() {
        return skipExisting;
    }

    public void setSkipExisting(boolean skipExisting) {
        this.skipExisting = skipExisting;
    }

    public Integer getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(Integer maxConcurrent) {
        if (maxConcurrent != null && maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1");
        }
        this.maxConcurrent = maxConcurrent;
    }

    public Integer getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(Integer chunkSize) {
        if (chunkSize != null && chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1");
        }
        this.chunkSize = chunkSize;
    }

    public ItemFailurePolicy getItemFailurePolicy() {
        return itemFailurePolicy;
    }

    public void setItemFailurePolicy(ItemFailurePolicy itemFailurePolicy) {
        this.itemFailurePolicy = itemFailurePolicy;
    }
}
