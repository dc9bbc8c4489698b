package com.scholary.video.fetcher.fileserver;

import com.scholary.video.fetcher.config.DownloadProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * The directory finished downloads are written to and served from.
 *
 * <p>This directory is the only trust boundary of the file server. A requested name is joined to
 * the root and must stay under it after {@code ..} segments and symlinks are resolved. Containment
 * is decided while the name is resolved, before its existence is checked, so a request that leads
 * outside the root gets the same answer whether or not the outside path exists.
 *
 * <p>Files are named after the video title, so two concurrent jobs for videos with the same title
 * write to the same file; the last one wins.
 */
@Component
public class ArtifactDirectory {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactDirectory.class);

  private static final String OUTPUT_TEMPLATE = "%(title)s.%(ext)s";

  private static final int MAX_LINK_HOPS = 40;

  private final Path root;

  @Autowired
  public ArtifactDirectory(DownloadProperties properties) {
    this(Paths.get(properties.downloadDir()));
  }

  public ArtifactDirectory(Path directory) {
    try {
      Files.createDirectories(directory);
      this.root = directory.toRealPath();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create download directory: " + directory, e);
    }
    LOGGER.info("Artifact directory: {}", root);
  }

  /** The resolved root directory. */
  public Path root() {
    return root;
  }

  /** Output path template for the extraction engine: files are named after the video title. */
  public String outputTemplate() {
    return root.resolve(OUTPUT_TEMPLATE).toString();
  }

  /**
   * Resolve a decoded file name to a servable file.
   *
   * @param name the file name as requested, already percent-decoded
   * @return the lookup outcome; never throws for bad input
   */
  public ArtifactLookup lookup(String name) {
    if (name == null || name.isEmpty()) {
      return ArtifactLookup.notFound();
    }

    Path candidate;
    try {
      candidate = root.resolve(name).normalize();
    } catch (InvalidPathException e) {
      LOGGER.debug("Rejected malformed file name: {}", e.getMessage());
      return ArtifactLookup.notFound();
    }

    // Lexical containment first: nothing below may probe paths outside the root
    if (!candidate.startsWith(root)) {
      return ArtifactLookup.forbidden();
    }
    if (candidate.equals(root)) {
      return ArtifactLookup.notFound();
    }

    Optional<Path> resolved;
    try {
      resolved = resolveWithinRoot(root, root.relativize(candidate), MAX_LINK_HOPS);
    } catch (IOException e) {
      LOGGER.debug("Could not resolve {}: {}", candidate, e.getMessage());
      return ArtifactLookup.notFound();
    }
    if (resolved.isEmpty()) {
      return ArtifactLookup.forbidden();
    }

    Path real = resolved.get();
    if (real.equals(root) || !Files.isRegularFile(real, LinkOption.NOFOLLOW_LINKS)) {
      return ArtifactLookup.notFound();
    }
    return ArtifactLookup.found(real);
  }

  /**
   * List the most recently modified regular files, newest first.
   *
   * @param limit maximum number of files to return
   * @throws IOException if the directory cannot be read
   */
  public List<ListedFile> listRecent(int limit) throws IOException {
    List<ListedFile> files = new ArrayList<>();
    try (Stream<Path> entries = Files.list(root)) {
      entries.forEach(
          entry -> {
            BasicFileAttributes attributes = readAttributes(entry);
            if (attributes != null && attributes.isRegularFile()) {
              files.add(
                  new ListedFile(
                      entry.getFileName().toString(),
                      attributes.size(),
                      attributes.lastModifiedTime().toInstant()));
            }
          });
    }
    files.sort(Comparator.comparing(ListedFile::lastModified).reversed());
    return files.size() > limit ? List.copyOf(files.subList(0, limit)) : files;
  }

  /**
   * Walk {@code relative} one name at a time starting at {@code start}, following each symlink as
   * it is met. Every intermediate path is checked against the root before the next name is looked
   * up, so no link or existence check ever runs outside the root. Names that do not exist are
   * appended as they are.
   *
   * @return the resolved path, or empty if any step leaves the root
   */
  private Optional<Path> resolveWithinRoot(Path start, Path relative, int hopsLeft)
      throws IOException {
    Path current = start;
    for (Path part : relative) {
      String element = part.toString();
      if (element.isEmpty() || element.equals(".")) {
        continue;
      }
      if (element.equals("..")) {
        current = current.getParent();
        if (current == null || !current.startsWith(root)) {
          return Optional.empty();
        }
        continue;
      }

      Path next = current.resolve(part);
      if (Files.isSymbolicLink(next)) {
        if (hopsLeft == 0) {
          return Optional.empty();
        }
        Path target = Files.readSymbolicLink(next);
        Optional<Path> followed;
        if (target.isAbsolute()) {
          followed =
              target.startsWith(root)
                  ? resolveWithinRoot(root, root.relativize(target), hopsLeft - 1)
                  : Optional.empty();
        } else {
          followed = resolveWithinRoot(current, target, hopsLeft - 1);
        }
        if (followed.isEmpty()) {
          return followed;
        }
        next = followed.get();
      }
      if (!next.startsWith(root)) {
        return Optional.empty();
      }
      current = next;
    }
    return Optional.of(current);
  }

  private static BasicFileAttributes readAttributes(Path entry) {
    try {
      return Files.readAttributes(entry, BasicFileAttributes.class);
    } catch (IOException e) {
      // Deleted or replaced while listing
      LOGGER.debug("Skipping {}: {}", entry.getFileName(), e.getMessage());
      return null;
    }
  }
}
