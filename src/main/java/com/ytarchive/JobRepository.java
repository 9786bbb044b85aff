package com.ytarchive;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface JobRepository {

    Job save(Job job);

    Optional<Job> findById(UUID id);

    /**
     * Jobs newest first, optionally restricted to one status.
     *
     * @param status status filter, or {@code null} for every job
     */
    List<Job> findAll(JobStatus status);

    /**
     * Deletes jobs in one of {@code statuses} that finished before {@code threshold}.
     *
     * @return number of deleted jobs
     */
    int deleteTerminalBefore(Collection<JobStatus> statuses, OffsetDateTime threshold);

    Map<JobStatus, Long> countByStatus();
}
