package com.scholary.video.fetcher.extraction;

import java.nio.file.Path;

/**
 * Result of a finished extraction.
 *
 * @param filePath the file the engine reports it wrote
 * @param videoCodec the codec tag of the video stream, or null when unknown or audio-only
 */
public record ExtractedMedia(Path filePath, String videoCodec) {}
