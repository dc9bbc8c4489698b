package com.scholary.video.fetcher.api;

import com.scholary.video.fetcher.job.JobStatus;
import com.scholary.video.fetcher.progress.Phase;

/**
 * Response for job status query.
 *
 * <p>{@code message} is what a chat front end would show in the job's status message. File
 * fields are set once the job has completed.
 */
public record JobStatusResponse(
    String jobId,
    JobStatus status,
    int percent,
    Phase phase,
    String message,
    String fileName,
    Double sizeMegabytes,
    String downloadUrl,
    String error) {}
