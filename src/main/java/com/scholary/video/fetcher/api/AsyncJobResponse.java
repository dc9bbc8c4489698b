package com.scholary.video.fetcher.api;

/** Returns a job ID that can be used to poll for status. */
public record AsyncJobResponse(String jobId) {}
