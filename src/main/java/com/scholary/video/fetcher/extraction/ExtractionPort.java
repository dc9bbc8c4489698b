package com.scholary.video.fetcher.extraction;

/**
 * Boundary to the external video-fetching engine.
 *
 * <p>Both operations block until the engine is done and must be called off request threads.
 * Implementations may wrap a library binding or a subprocess; callers do not depend on which.
 */
public interface ExtractionPort {

  /**
   * Fetch video metadata without downloading.
   *
   * @throws ExtractionFailedException if the source cannot be fetched or parsed
   */
  VideoInfo probe(String url, ExtractionOptions options);

  /**
   * Download (and post-process) a video.
   *
   * @param spec what to download and where to
   * @param options environment-specific engine options
   * @param hook receives raw progress while downloading
   * @return the final container metadata
   * @throws ExtractionFailedException if the download fails
   */
  ExtractedMedia download(DownloadSpec spec, ExtractionOptions options, ProgressHook hook);
}
