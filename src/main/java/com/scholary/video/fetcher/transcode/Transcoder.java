package com.scholary.video.fetcher.transcode;

import java.nio.file.Path;

/** Re-encodes a video into a widely playable format. Blocks until done. */
public interface Transcoder {

  /**
   * Re-encode {@code input} to H.264 video and AAC audio with the index at the front of the file.
   *
   * @param input the source file, left untouched
   * @param output where to write the result; overwritten if present
   * @throws TranscodeFailedException if the encoder cannot be started or fails
   */
  void transcodeToH264(Path input, Path output);
}
