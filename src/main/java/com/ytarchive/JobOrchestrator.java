package com.ytarchive;

import com.ytarchive.collaborator.ArchiveStorage;
import com.ytarchive.collaborator.DownloadResult;
import com.ytarchive.collaborator.MetadataService;
import com.ytarchive.collaborator.PlaylistEntry;
import com.ytarchive.collaborator.PlaylistMetadata;
import com.ytarchive.collaborator.VideoDownloader;
import com.ytarchive.collaborator.VideoMetadata;
import com.ytarchive.config.YtArchiveProperties;
import com.ytarchive.internal.BatchExecutor;
import com.ytarchive.internal.BatchPlan;
import com.ytarchive.internal.YouTubeUrls;
import com.ytarchive.recovery.AttemptRecord;
import com.ytarchive.recovery.CancellationToken;
import com.ytarchive.recovery.ErrorContext;
import com.ytarchive.recovery.ErrorRecoveryManager;
import com.ytarchive.recovery.RecoverableOperation;
import com.ytarchive.recovery.RecoveryResult;
import com.ytarchive.recovery.RecoverySnapshot;
import com.ytarchive.recovery.RetryListener;
import com.ytarchive.recovery.RetryReason;
import com.ytarchive.recovery.RetryStrategy;
import com.ytarchive.recovery.ServiceErrorHandler;
import com.ytarchive.recovery.handler.DownloadErrorHandler;
import com.ytarchive.recovery.handler.MetadataErrorHandler;
import com.ytarchive.recovery.handler.StorageErrorHandler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Job API and execution engine. Jobs are run on a small runner pool; the items of a job run on a
 * shared worker pool through {@link BatchExecutor}, and every collaborator call goes through
 * {@link ErrorRecoveryManager}.
 */
public class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final JobRepository jobRepository;
    private final RecoveryPlanRepository recoveryPlanRepository;
    private final ErrorRecoveryManager recoveryManager;
    private final MetadataService metadataService;
    private final VideoDownloader downloader;
    private final ArchiveStorage storage;
    private final YtArchiveProperties properties;
    private final Clock clock;
    private final Map<String, ServiceErrorHandler> handlers = new HashMap<>();
    private final Map<String, RetryStrategy> strategies = new HashMap<>();
    private final Map<UUID, RunningJob> runningJobs = new ConcurrentHashMap<>();
    private final List<ProgressListener> progressListeners = new CopyOnWriteArrayList<>();
    private final ThreadPoolExecutor jobRunner;
    private final ThreadPoolExecutor workerPool;
    private final BatchExecutor batchExecutor;

    public JobOrchestrator(
            JobRepository jobRepository,
            RecoveryPlanRepository recoveryPlanRepository,
            ErrorRecoveryManager recoveryManager,
            MetadataService metadataService,
            VideoDownloader downloader,
            ArchiveStorage storage,
            List<ServiceErrorHandler> serviceErrorHandlers,
            YtArchiveProperties properties,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.recoveryPlanRepository = recoveryPlanRepository;
        this.recoveryManager = recoveryManager;
        this.metadataService = metadataService;
        this.downloader = downloader;
        this.storage = storage;
        this.properties = properties;
        this.clock = clock;

        registerHandler(new MetadataErrorHandler());
        registerHandler(new DownloadErrorHandler());
        registerHandler(new StorageErrorHandler());
        if (serviceErrorHandlers != null) {
            serviceErrorHandlers.forEach(this::registerHandler);
        }

        YtArchiveProperties.Recovery recovery = properties.getRecovery();
        strategies.put(MetadataErrorHandler.SERVICE_NAME, strategyFor(recovery, recovery.getMetadata()));
        strategies.put(DownloadErrorHandler.SERVICE_NAME, strategyFor(recovery, recovery.getDownload()));
        strategies.put(StorageErrorHandler.SERVICE_NAME, strategyFor(recovery, recovery.getStorage()));

        int runnerCount = Math.max(1, properties.getBackgroundJobServer().getJobRunnerCount());
        this.jobRunner = new ThreadPoolExecutor(runnerCount, runnerCount, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory("ytarchive-job-"));
        int workerCount = Math.max(1, properties.getBackgroundJobServer().getWorkerCount());
        this.workerPool = new ThreadPoolExecutor(workerCount, workerCount, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory("ytarchive-worker-"));
        this.batchExecutor = new BatchExecutor(workerPool);
    }

    public void addProgressListener(ProgressListener listener) {
        progressListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public Job createJob(JobType type, List<String> urls, JobOptions options) {
        if (type == null) {
            throw new IllegalArgumentException("Job type must not be null");
        }
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("At least one URL is required");
        }
        List<String> cleaned = new ArrayList<>();
        for (String url : urls) {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("URLs must not be blank");
            }
            cleaned.add(url.trim());
        }

        Job job = new Job(UUID.randomUUID(), type, cleaned, options, now());
        jobRepository.save(job);
        log.info("Created {} job {} with {} URLs", type, job.getId(), cleaned.size());
        return job;
    }

    /**
     * Queues a created job for execution.
     *
     * @return a future completed with the job once it reached a terminal status
     * @throws IllegalArgumentException if the job does not exist
     * @throws IllegalStateException if the job was already executed or cancelled
     */
    public CompletableFuture<Job> executeJob(UUID jobId) {
        Job job = requireJob(jobId);
        job.transitionTo(JobStatus.QUEUED, now());
        RunningJob running = new RunningJob(job);
        runningJobs.put(jobId, running);
        saveQuietly(job);

        return CompletableFuture.supplyAsync(() -> runJob(running), jobRunner);
    }

    public Optional<Job> getJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> listJobs() {
        return jobRepository.findAll(null);
    }

    public List<Job> listJobs(JobStatus status) {
        return jobRepository.findAll(status);
    }

    /**
     * Cancels a job. In-flight items are interrupted, finished results are kept. Cancelling a job
     * that already finished has no effect.
     *
     * @throws IllegalArgumentException if the job does not exist
     */
    public Job cancelJob(UUID jobId) {
        Job job = requireJob(jobId);
        if (!job.tryTransitionTo(JobStatus.CANCELLED, now())) {
            log.debug("Job {} already {}, nothing to cancel", jobId, job.getStatus());
            return job;
        }
        RunningJob running = runningJobs.get(jobId);
        if (running != null) {
            running.token.cancel();
        }
        saveQuietly(job);
        notifyProgress(job);
        log.info("Cancelled job {}", jobId);
        return job;
    }

    public RecoveryPlan getRecoveryPlan() {
        return RecoveryPlan.of(recoveryPlanRepository.findAll(), now());
    }

    /**
     * Creates a best-effort download job for the given recovery plan items. The job still has to be
     * executed.
     *
     * @throws IllegalArgumentException if none of the ids is in the recovery plan
     */
    public Job resubmitRecoveryPlan(Collection<String> itemIds) {
        Set<String> requested = new LinkedHashSet<>(itemIds == null ? List.of() : itemIds);
        List<String> urls = new ArrayList<>();
        for (String itemId : requested) {
            recoveryPlanRepository.findByItemId(itemId).ifPresent(entry -> urls.add(YouTubeUrls.watchUrl(itemId)));
        }
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("None of " + requested + " is in the recovery plan");
        }
        JobOptions options = JobOptions.defaults();
        options.setItemFailurePolicy(ItemFailurePolicy.BEST_EFFORT);
        Job job = createJob(JobType.VIDEO_DOWNLOAD, urls, options);
        log.info("Resubmitted {} recovery plan items as job {}", urls.size(), job.getId());
        return job;
    }

    public List<RecoverySnapshot> getActiveRecoveries() {
        return recoveryManager.getActiveRecoveries();
    }

    @PreDestroy
    public void shutdown() {
        for (RunningJob running : runningJobs.values()) {
            running.token.cancel();
        }
        jobRunner.shutdownNow();
        workerPool.shutdownNow();
    }

    private Job runJob(RunningJob running) {
        Job job = running.job;
        try {
            if (!job.tryTransitionTo(JobStatus.RUNNING, now())) {
                return job;
            }
            saveQuietly(job);
            notifyProgress(job);
            log.info("Running {} job {}", job.getType(), job.getId());

            List<ExpandedPlaylist> playlists = new ArrayList<>();
            List<WorkItem> items = new ArrayList<>();
            List<JobResult> preResolved = new ArrayList<>();
            if (job.getType() == JobType.PLAYLIST_DOWNLOAD) {
                expandPlaylists(running, items, preResolved, playlists);
            } else {
                for (String url : job.getUrls()) {
                    items.add(new WorkItem(url, YouTubeUrls.videoId(url)));
                }
            }

            int total = items.size() + preResolved.size();
            job.setProgress(JobProgress.of(total));
            if (!preResolved.isEmpty()) {
                recordChunk(job, total, preResolved);
            }

            BatchPlan plan = BatchPlan.forItems(items.size(), job.getOptions(), properties.getBatch());
            log.debug("Job {} runs {} items with concurrency {} in chunks of {}", job.getId(), items.size(),
                    plan.concurrency(), plan.chunkSize());
            batchExecutor.execute(items, plan,
                    item -> processItem(running, item),
                    (item, failure) -> unexpectedFailure(item, failure),
                    chunk -> recordChunk(job, total, chunk),
                    running.token);

            finish(running, playlists);
        } catch (RuntimeException unexpected) {
            log.error("Job {} failed unexpectedly", job.getId(), unexpected);
            job.setErrorMessage(unexpected.getMessage());
            job.tryTransitionTo(JobStatus.RUNNING, now());
            job.tryTransitionTo(JobStatus.FAILED, now());
        } finally {
            runningJobs.remove(job.getId());
            saveQuietly(job);
            notifyProgress(job);
        }
        return job;
    }

    /**
     * Resolves every playlist URL of the job into work items. A playlist that cannot be parsed,
     * fetched or that has no entries is recorded as failed and the remaining playlists still run.
     */
    private void expandPlaylists(RunningJob running, List<WorkItem> items, List<JobResult> preResolved,
            List<ExpandedPlaylist> playlists) {
        Job job = running.job;
        for (String url : job.getUrls()) {
            String playlistId = YouTubeUrls.playlistId(url);
            if (playlistId == null) {
                playlists.add(ExpandedPlaylist.failed(url, null, "Could not extract playlist ID from URL: " + url));
                continue;
            }
            ErrorContext context = contextFor(job, "fetch_playlist", playlistId, MetadataErrorHandler.SERVICE_NAME);
            RecoveryResult<PlaylistMetadata> result = call(running, context, MetadataErrorHandler.SERVICE_NAME,
                    () -> metadataService.fetchPlaylist(playlistId));
            if (result.isCancelled()) {
                return;
            }
            if (!result.isSuccess() || result.value() == null) {
                playlists.add(ExpandedPlaylist.failed(url, playlistId,
                        "Playlist " + playlistId + " could not be fetched: " + result.failureMessage()));
                continue;
            }

            PlaylistMetadata playlist = result.value();
            if (playlist.entries().isEmpty()) {
                log.warn("Playlist {} of job {} has no entries", playlistId, job.getId());
                playlists.add(ExpandedPlaylist.failed(url, playlistId,
                        "Playlist " + playlistId + " is empty or unavailable"));
                continue;
            }
            log.info("Playlist {} has {} entries", playlistId, playlist.entries().size());
            List<String> videoIds = new ArrayList<>();
            for (PlaylistEntry entry : playlist.entries()) {
                videoIds.add(entry.videoId());
                if (entry.available()) {
                    items.add(new WorkItem(YouTubeUrls.watchUrl(entry.videoId()), entry.videoId()));
                } else {
                    preResolved.add(unavailableEntry(job, entry));
                }
            }
            playlists.add(new ExpandedPlaylist(url, playlistId, playlist.title(), videoIds, null));
        }
    }

    private JobResult processItem(RunningJob running, WorkItem item) {
        OffsetDateTime startedAt = now();
        long startNanos = System.nanoTime();
        if (running.token.isCancelled()) {
            return null;
        }
        if (item.videoId() == null) {
            return JobResult.failed(item.url(), ErrorCode.E007, "Could not extract video ID from URL: " + item.url(),
                    0, List.of(), startedAt, 0L);
        }
        return running.job.getType() == JobType.METADATA_ONLY
                ? processMetadata(running, item.videoId(), startedAt, startNanos)
                : processVideo(running, item.videoId(), startedAt, startNanos);
    }

    private JobResult processVideo(RunningJob running, String videoId, OffsetDateTime startedAt, long startNanos) {
        Job job = running.job;
        JobOptions options = job.getOptions();

        if (options.isSkipExisting()) {
            ErrorContext existsContext = contextFor(job, "check_exists", videoId, StorageErrorHandler.SERVICE_NAME);
            RecoveryResult<Boolean> exists = call(running, existsContext, StorageErrorHandler.SERVICE_NAME,
                    () -> storage.videoExists(videoId));
            if (!exists.isSuccess()) {
                return failItem(job, videoId, exists, existsContext, StorageErrorHandler.SERVICE_NAME, startedAt,
                        startNanos);
            }
            if (Boolean.TRUE.equals(exists.value())) {
                log.debug("Video {} already archived, skipping", videoId);
                return JobResult.skipped(videoId, "Already archived", startedAt);
            }
        }

        ErrorContext pathContext = contextFor(job, "storage_path", videoId, StorageErrorHandler.SERVICE_NAME);
        RecoveryResult<String> path = call(running, pathContext, StorageErrorHandler.SERVICE_NAME,
                () -> storage.storagePathFor(videoId, options.getOutputDir()));
        if (!path.isSuccess()) {
            return failItem(job, videoId, path, pathContext, StorageErrorHandler.SERVICE_NAME, startedAt, startNanos);
        }

        ErrorContext downloadContext = contextFor(job, "download_video", videoId, DownloadErrorHandler.SERVICE_NAME);
        RecoveryResult<DownloadResult> download = call(running, downloadContext, DownloadErrorHandler.SERVICE_NAME,
                () -> downloader.download(videoId, path.value(), options));
        if (!download.isSuccess()) {
            return failItem(job, videoId, download, downloadContext, DownloadErrorHandler.SERVICE_NAME, startedAt,
                    startNanos);
        }

        DownloadResult downloaded = download.value();
        ErrorContext savedContext = contextFor(job, "record_video_saved", videoId, StorageErrorHandler.SERVICE_NAME);
        RecoveryResult<Void> saved = call(running, savedContext, StorageErrorHandler.SERVICE_NAME, () -> {
            storage.recordVideoSaved(videoId, downloaded);
            return null;
        });
        if (!saved.isSuccess()) {
            return failItem(job, videoId, saved, savedContext, StorageErrorHandler.SERVICE_NAME, startedAt,
                    startNanos);
        }

        String filePath = downloaded != null ? downloaded.filePath() : path.value();
        Long fileSize = downloaded != null ? downloaded.fileSize() : null;
        return JobResult.success(videoId, downloadContext.attemptCount(), delaysOf(downloadContext), filePath,
                fileSize, startedAt, elapsedMillis(startNanos));
    }

    private JobResult processMetadata(RunningJob running, String videoId, OffsetDateTime startedAt,
            long startNanos) {
        Job job = running.job;
        ErrorContext fetchContext = contextFor(job, "fetch_video_metadata", videoId,
                MetadataErrorHandler.SERVICE_NAME);
        RecoveryResult<VideoMetadata> metadata = call(running, fetchContext, MetadataErrorHandler.SERVICE_NAME,
                () -> metadataService.fetchVideo(videoId));
        if (!metadata.isSuccess()) {
            return failItem(job, videoId, metadata, fetchContext, MetadataErrorHandler.SERVICE_NAME, startedAt,
                    startNanos);
        }

        ErrorContext saveContext = contextFor(job, "save_metadata", videoId, StorageErrorHandler.SERVICE_NAME);
        RecoveryResult<Void> saved = call(running, saveContext, StorageErrorHandler.SERVICE_NAME, () -> {
            storage.saveMetadata(metadata.value());
            return null;
        });
        if (!saved.isSuccess()) {
            return failItem(job, videoId, saved, saveContext, StorageErrorHandler.SERVICE_NAME, startedAt,
                    startNanos);
        }
        return JobResult.success(videoId, fetchContext.attemptCount(), delaysOf(fetchContext), null, null, startedAt,
                elapsedMillis(startNanos));
    }

    private <T> RecoveryResult<T> call(RunningJob running, ErrorContext context, String service,
            RecoverableOperation<T> operation) {
        return recoveryManager.executeWithRetry(operation, context, strategies.get(service), handlers.get(service),
                running.token, running);
    }

    /**
     * Turns a terminal recovery result into a failed item and a recovery plan entry. Cancelled items
     * produce no result.
     */
    private JobResult failItem(Job job, String videoId, RecoveryResult<?> result, ErrorContext context,
            String service, OffsetDateTime startedAt, long startNanos) {
        if (result.isCancelled()) {
            return null;
        }
        ErrorCode errorCode = ErrorCode.from(result.outcome(), result.reason(), service);
        String message = result.failureMessage();
        OffsetDateTime lastAttemptAt = lastAttemptAt(context, startedAt);
        PlanEntryKind kind = result.isPermanentlyUnavailable() ? PlanEntryKind.UNAVAILABLE : PlanEntryKind.FAILED;
        OffsetDateTime retryAfter = null;
        AttemptRecord last = context.lastAttempt();
        if (last != null && last.retryAfter() != null) {
            retryAfter = lastAttemptAt.plus(last.retryAfter());
        } else if (kind == PlanEntryKind.FAILED) {
            retryAfter = lastAttemptAt.plus(properties.getRecovery().getPlanRetryAfter());
        }
        recordPlanEntry(new RecoveryPlanEntry(videoId, job.getId(), kind, result.reason(), errorCode, message,
                context.attemptCount(), lastAttemptAt, lastAttemptAt, retryAfter));
        log.warn("Item {} of job {} failed with {} after {} attempts: {}", videoId, job.getId(), errorCode,
                context.attemptCount(), message);
        return JobResult.failed(videoId, errorCode, message, context.attemptCount(), delaysOf(context), startedAt,
                elapsedMillis(startNanos));
    }

    private JobResult unavailableEntry(Job job, PlaylistEntry entry) {
        OffsetDateTime now = now();
        String message = entry.unavailableReason() != null ? entry.unavailableReason() : "Video unavailable";
        recordPlanEntry(new RecoveryPlanEntry(entry.videoId(), job.getId(), PlanEntryKind.UNAVAILABLE,
                RetryReason.RESOURCE_UNAVAILABLE, ErrorCode.E002, message, 0, now, now, null));
        return JobResult.failed(entry.videoId(), ErrorCode.E002, message, 0, List.of(), now, 0L);
    }

    private JobResult unexpectedFailure(WorkItem item, Throwable failure) {
        String itemId = item.videoId() != null ? item.videoId() : item.url();
        return JobResult.failed(itemId, ErrorCode.E999, String.valueOf(failure.getMessage()), 0, List.of(), now(),
                0L);
    }

    private void recordPlanEntry(RecoveryPlanEntry entry) {
        try {
            recoveryPlanRepository.record(entry);
        } catch (RuntimeException e) {
            log.warn("Failed to add {} to the recovery plan: {}", entry.itemId(), e.getMessage());
        }
    }

    private void recordChunk(Job job, int total, List<JobResult> chunk) {
        job.addResults(chunk, now());
        job.setProgress(new JobProgress(total, (int) job.countResults(ItemStatus.SUCCESS),
                (int) job.countResults(ItemStatus.FAILED), (int) job.countResults(ItemStatus.SKIPPED)));
        saveQuietly(job);
        notifyProgress(job);
    }

    /**
     * Decides the terminal status. A playlist job fails only when every one of its playlists failed
     * to expand; otherwise the item failure policy decides and failed playlists are listed in the
     * error message.
     */
    private void finish(RunningJob running, List<ExpandedPlaylist> playlists) {
        Job job = running.job;
        if (running.token.isCancelled() || job.getStatus() == JobStatus.CANCELLED) {
            log.info("Job {} stopped after cancellation with {} results", job.getId(), job.getResults().size());
            return;
        }
        // a RETRYING flag may still be set if the last backoff ended by interruption
        job.tryTransitionTo(JobStatus.RUNNING, now());

        List<String> playlistErrors = new ArrayList<>();
        for (ExpandedPlaylist playlist : playlists) {
            if (playlist.error() != null) {
                playlistErrors.add(playlist.error());
            }
        }
        if (job.getType() == JobType.PLAYLIST_DOWNLOAD) {
            publishPlaylistReport(running, playlists);
        }

        long failed = job.countResults(ItemStatus.FAILED);
        int processed = job.getResults().size();
        ItemFailurePolicy policy = job.getOptions().resolveFailurePolicy(job.getType());
        String playlistNote = playlistErrors.isEmpty() ? "" : "; " + String.join("; ", playlistErrors);
        if (!playlistErrors.isEmpty() && playlistErrors.size() == playlists.size()) {
            job.setErrorMessage("All " + playlists.size() + " playlists failed to process" + playlistNote);
            job.tryTransitionTo(JobStatus.FAILED, now());
        } else if (failed > 0 && policy == ItemFailurePolicy.FAIL_JOB) {
            job.setErrorMessage(failed + " of " + processed + " items failed" + playlistNote);
            job.tryTransitionTo(JobStatus.FAILED, now());
        } else {
            if (failed > 0) {
                job.setErrorMessage(failed + " of " + processed + " items failed, see recovery plan" + playlistNote);
            } else if (!playlistErrors.isEmpty()) {
                job.setErrorMessage(playlistErrors.size() + " of " + playlists.size() + " playlists failed"
                        + playlistNote);
            }
            job.tryTransitionTo(JobStatus.COMPLETED, now());
        }
        log.info("Job {} finished {}: {} succeeded, {} failed, {} skipped", job.getId(), job.getStatus(),
                job.countResults(ItemStatus.SUCCESS), failed, job.countResults(ItemStatus.SKIPPED));
    }

    /**
     * Builds the per-playlist breakdown from the job results, keeps it on the job and pushes it to
     * storage. A storage failure is logged and does not change the job outcome.
     */
    private void publishPlaylistReport(RunningJob running, List<ExpandedPlaylist> playlists) {
        Job job = running.job;
        Map<String, ItemStatus> statusByItem = new HashMap<>();
        for (JobResult result : job.getResults()) {
            statusByItem.put(result.itemId(), result.status());
        }
        List<PlaylistSummary> summaries = new ArrayList<>();
        for (ExpandedPlaylist playlist : playlists) {
            summaries.add(playlist.summarize(statusByItem));
        }
        PlaylistReport report = PlaylistReport.of(job.getId(), summaries, now());
        job.setPlaylistReport(report);
        log.info("Job {} playlists: {}/{} successful, videos: {}/{} downloaded ({}%)", job.getId(),
                report.successfulPlaylists(), report.totalPlaylists(), report.successfulDownloads(),
                report.totalVideos(), report.overallSuccessRate());

        ErrorContext context = contextFor(job, "save_playlist_report", job.getId().toString(),
                StorageErrorHandler.SERVICE_NAME);
        RecoveryResult<Void> saved = call(running, context, StorageErrorHandler.SERVICE_NAME, () -> {
            storage.savePlaylistReport(report);
            return null;
        });
        if (!saved.isSuccess() && !saved.isCancelled()) {
            log.warn("Failed to store playlist report of job {}: {}", job.getId(), saved.failureMessage());
        }
    }

    private ErrorContext contextFor(Job job, String operation, String resourceId, String service) {
        return ErrorContext.builder(operation, resourceId)
                .resourceKey(service)
                .traceId(job.getId() + "/" + resourceId)
                .jobId(job.getId())
                .build();
    }

    private RetryStrategy strategyFor(YtArchiveProperties.Recovery recovery, YtArchiveProperties.Service service) {
        return recoveryManager.strategies().create(service.getStrategy(), recovery.toRetryConfig(service));
    }

    private void registerHandler(ServiceErrorHandler handler) {
        handlers.put(handler.serviceName(), handler);
    }

    private Job requireJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job " + jobId));
    }

    private void saveQuietly(Job job) {
        try {
            jobRepository.save(job);
        } catch (RuntimeException e) {
            log.warn("Failed to persist job {}: {}", job.getId(), e.getMessage());
        }
    }

    private void notifyProgress(Job job) {
        JobProgress progress = job.getProgress();
        for (ProgressListener listener : progressListeners) {
            try {
                listener.onProgress(job, progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for job {}", job.getId(), e);
            }
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static OffsetDateTime lastAttemptAt(ErrorContext context, OffsetDateTime fallback) {
        AttemptRecord last = context.lastAttempt();
        return last == null ? fallback : last.startedAt().atOffset(ZoneOffset.UTC);
    }

    private static List<Long> delaysOf(ErrorContext context) {
        List<Long> delays = new ArrayList<>();
        for (Duration delay : context.appliedDelays()) {
            delays.add(delay.toMillis());
        }
        return delays;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record WorkItem(String url, String videoId) {
    }

    private record ExpandedPlaylist(String url, String playlistId, String title, List<String> videoIds,
            String error) {

        static ExpandedPlaylist failed(String url, String playlistId, String error) {
            return new ExpandedPlaylist(url, playlistId, null, List.of(), error);
        }

        PlaylistSummary summarize(Map<String, ItemStatus> statusByItem) {
            if (error != null) {
                return PlaylistSummary.failed(url, playlistId, error);
            }
            int succeeded = 0;
            int failed = 0;
            int skipped = 0;
            for (String videoId : videoIds) {
                ItemStatus status = statusByItem.get(videoId);
                if (status == ItemStatus.SUCCESS) {
                    succeeded++;
                } else if (status == ItemStatus.FAILED) {
                    failed++;
                } else if (status == ItemStatus.SKIPPED) {
                    skipped++;
                }
            }
            return new PlaylistSummary(url, playlistId, title, videoIds.size(), succeeded, failed, skipped, null);
        }
    }

    /**
     * Execution state of one job. Doubles as the retry listener that flips the job between RUNNING
     * and RETRYING while any of its items is waiting out a backoff.
     */
    private final class RunningJob implements RetryListener {
        private final Job job;
        private final CancellationToken token = new CancellationToken();
        private int waitingItems;

        private RunningJob(Job job) {
            this.job = job;
        }

        @Override
        public synchronized void onBackoffStarted(ErrorContext context, Duration delay) {
            waitingItems++;
            if (waitingItems == 1) {
                job.tryTransitionTo(JobStatus.RETRYING, now());
            }
        }

        @Override
        public synchronized void onBackoffFinished(ErrorContext context) {
            waitingItems = Math.max(0, waitingItems - 1);
            if (waitingItems == 0) {
                job.tryTransitionTo(JobStatus.RUNNING, now());
            }
        }
    }
}
