package com.ytarchive;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A unit of archiving work. Status changes go through {@link #transitionTo(JobStatus, OffsetDateTime)};
 * the plain setters exist for deserialization.
 */
public class Job {

    private UUID id;
    private JobType type;
    private JobStatus status = JobStatus.CREATED;
    private List<String> urls = new ArrayList<>();
    private JobOptions options = JobOptions.defaults();
    private final List<JobResult> results = new ArrayList<>();
    private String errorMessage;
    private JobProgress progress = JobProgress.of(0);
    private PlaylistReport playlistReport;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;

    public Job() {
    }

    public Job(UUID id, JobType type, List<String> urls, JobOptions options, OffsetDateTime createdAt) {
        this.id = id;
        this.type = type;
        this.urls = new ArrayList<>(urls);
        this.options = options != null ? options : JobOptions.defaults();
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * Moves the job along its lifecycle.
     *
     * @throws IllegalStateException if the transition is not allowed from the current status
     */
    public synchronized void transitionTo(JobStatus target, OffsetDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + target);
        }
        if (target == JobStatus.RUNNING && startedAt == null) {
            startedAt = now;
        }
        if (target.isTerminal()) {
            finishedAt = now;
        }
        status = target;
        updatedAt = now;
    }

    /**
     * Same as {@link #transitionTo(JobStatus, OffsetDateTime)} but returns {@code false} instead of
     * throwing when the job already moved on.
     */
    public synchronized boolean tryTransitionTo(JobStatus target, OffsetDateTime now) {
        if (!status.canTransitionTo(target)) {
            return false;
        }
        transitionTo(target, now);
        return true;
    }

    public synchronized void addResults(List<JobResult> newResults, OffsetDateTime now) {
        results.addAll(newResults);
        updatedAt = now;
    }

    public synchronized UUID getId() {
        return id;
    }

    public synchronized void setId(UUID id) {
        this.id = id;
    }

    public synchronized JobType getType() {
        return type;
    }

    public synchronized void setType(JobType type) {
        this.type = type;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized void setStatus(JobStatus status) {
        this.status = status;
    }

    public synchronized List<String> getUrls() {
        return List.copyOf(urls);
    }

    public synchronized void setUrls(List<String> urls) {
        this.urls = urls == null ? new ArrayList<>() : new ArrayList<>(urls);
    }

    public synchronized JobOptions getOptions() {
        return options;
    }

    public synchronized void setOptions(JobOptions options) {
        this.options = options != null ? options : JobOptions.defaults();
    }

    public synchronized List<JobResult> getResults() {
        return List.copyOf(results);
    }

    public synchronized void setResults(List<JobResult> results) {
        this.results.clear();
        if (results != null) {
            this.results.addAll(results);
        }
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public synchronized JobProgress getProgress() {
        return progress;
    }

    public synchronized void setProgress(JobProgress progress) {
        this.progress = progress;
    }

    public synchronized PlaylistReport getPlaylistReport() {
        return playlistReport;
    }

    public synchronized void setPlaylistReport(PlaylistReport playlistReport) {
        this.playlistReport = playlistReport;
    }

    public synchronized OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public synchronized void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public synchronized OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public synchronized void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public synchronized OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public synchronized void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public synchronized OffsetDateTime getFinishedAt() {
        return finishedAt;
    }

    public synchronized void setFinishedAt(OffsetDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }

    @JsonIgnore
    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    @JsonIgnore
    public synchronized long countResults(ItemStatus itemStatus) {
        return results.stream().filter(result -> result.status() == itemStatus).count();
    }
}
