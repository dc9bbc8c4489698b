package com.scholary.video.fetcher.fileserver;

import java.nio.file.Path;

/**
 * Outcome of resolving a requested file name against the artifact directory.
 *
 * @param status whether the file can be served
 * @param path the resolved file, only set when {@code status} is {@link Status#FOUND}
 */
public record ArtifactLookup(Status status, Path path) {

  public enum Status {
    FOUND,
    /** The name points outside the artifact directory. */
    FORBIDDEN,
    /** The name is inside the artifact directory but no regular file is there. */
    NOT_FOUND
  }

  static ArtifactLookup found(Path path) {
    return new ArtifactLookup(Status.FOUND, path);
  }

  static ArtifactLookup forbidden() {
    return new ArtifactLookup(Status.FORBIDDEN, null);
  }

  static ArtifactLookup notFound() {
    return new ArtifactLookup(Status.NOT_FOUND, null);
  }
}
