package com.ytarchive.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ytarchive.Job;
import com.ytarchive.JobRepository;
import com.ytarchive.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps every job in memory and mirrors it to {@code <id>.json} in the jobs directory. Existing
 * files are loaded on startup.
 */
public class FileJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(FileJobRepository.class);

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<UUID, Job> jobs = new ConcurrentHashMap<>();
    private final Map<UUID, Object> writeLocks = new ConcurrentHashMap<>();

    public FileJobRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        load();
    }

    /**
     * Serializes and writes under one per-job lock, so concurrent saves of the same job land on disk
     * in the order their snapshots were taken.
     */
    @Override
    public Job save(Job job) {
        UUID id = job.getId();
        synchronized (writeLockFor(id)) {
            byte[] json;
            synchronized (job) {
                try {
                    json = objectMapper.writeValueAsBytes(job);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to serialize job " + id, e);
                }
            }
            jobs.put(id, job);
            try {
                Files.createDirectories(directory);
                Path temp = directory.resolve(id + ".json.tmp");
                Files.write(temp, json);
                Files.move(temp, fileFor(id), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write job " + id, e);
            }
        }
        return job;
    }

    @Override
    public Optional<Job> findById(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<Job> findAll(JobStatus status) {
        List<Job> matching = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (status == null || job.getStatus() == status) {
                matching.add(job);
            }
        }
        matching.sort(Comparator.comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return matching;
    }

    @Override
    public int deleteTerminalBefore(Collection<JobStatus> statuses, OffsetDateTime threshold) {
        int deleted = 0;
        for (Job job : jobs.values()) {
            OffsetDateTime finishedAt = job.getFinishedAt();
            if (!statuses.contains(job.getStatus()) || finishedAt == null || !finishedAt.isBefore(threshold)) {
                continue;
            }
            synchronized (writeLockFor(job.getId())) {
                jobs.remove(job.getId());
                try {
                    Files.deleteIfExists(fileFor(job.getId()));
                } catch (IOException e) {
                    log.warn("Failed to delete job file for {}: {}", job.getId(), e.getMessage());
                }
            }
            writeLocks.remove(job.getId());
            deleted++;
        }
        return deleted;
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (Job job : jobs.values()) {
            counts.merge(job.getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    private Object writeLockFor(UUID id) {
        return writeLocks.computeIfAbsent(id, key -> new Object());
    }

    private Path fileFor(UUID id) {
        return directory.resolve(id + ".json");
    }

    private void load() {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                try {
                    Job job = objectMapper.readValue(file.toFile(), Job.class);
                    jobs.put(job.getId(), job);
                } catch (IOException e) {
                    log.warn("Skipping unreadable job file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list jobs in " + directory, e);
        }
        log.info("Loaded {} jobs from {}", jobs.size(), directory);
    }
}
