package com.scholary.video.fetcher.fileserver;

import com.scholary.video.fetcher.config.DownloadProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriUtils;

/**
 * Minimal static file server for finished downloads.
 *
 * <ul>
 *   <li>{@code GET /} lists the most recent files with their size
 *   <li>{@code GET /download/{name}} streams one file as an attachment
 * </ul>
 *
 * <p>The file name is taken from the raw request path and decoded here, so that encoded slashes
 * and dot segments reach {@link ArtifactDirectory#lookup} unchanged. Names that leave the artifact
 * directory get 403; names inside it that do not exist get 404.
 */
@RestController
@Tag(name = "Files", description = "Browse and download finished files")
public class FileServerController {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileServerController.class);

  static final String DOWNLOAD_PREFIX = "/download/";

  private static final MediaType TEXT_HTML_UTF8 =
      new MediaType("text", "html", StandardCharsets.UTF_8);
  private static final MediaType TEXT_PLAIN_UTF8 =
      new MediaType("text", "plain", StandardCharsets.UTF_8);

  private final ArtifactDirectory artifactDirectory;
  private final int listingLimit;

  @Autowired
  public FileServerController(ArtifactDirectory artifactDirectory, DownloadProperties properties) {
    this(artifactDirectory, properties.listingLimit());
  }

  FileServerController(ArtifactDirectory artifactDirectory, int listingLimit) {
    this.artifactDirectory = artifactDirectory;
    this.listingLimit = listingLimit;
  }

  @GetMapping("/")
  @Operation(summary = "List files", description = "HTML page with the most recent downloads")
  public ResponseEntity<String> index() {
    List<ListedFile> files;
    try {
      files = artifactDirectory.listRecent(listingLimit);
    } catch (IOException e) {
      LOGGER.error("Failed to list download directory", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .contentType(TEXT_PLAIN_UTF8)
          .body("Could not list files");
    }

    StringBuilder html = new StringBuilder();
    html.append("<html><head><title>Downloads</title></head><body>");
    html.append("<h1>Downloaded Files</h1><ul>");
    for (ListedFile file : files) {
      html.append("<li><a href=\"")
          .append(DOWNLOAD_PREFIX)
          .append(UriUtils.encodePathSegment(file.name(), StandardCharsets.UTF_8))
          .append("\">")
          .append(HtmlUtils.htmlEscape(file.name(), StandardCharsets.UTF_8.name()))
          .append("</a> (")
          .append(String.format(Locale.ROOT, "%.1f", file.sizeMegabytes()))
          .append(" MB)</li>");
    }
    html.append("</ul></body></html>");

    return ResponseEntity.ok().contentType(TEXT_HTML_UTF8).body(html.toString());
  }

  @GetMapping(DOWNLOAD_PREFIX + "**")
  @Operation(
      summary = "Download a file",
      description = "Streams a file from the download directory as an attachment")
  public ResponseEntity<?> download(HttpServletRequest request) {
    String name = requestedName(request);
    ArtifactLookup lookup =
        name == null ? ArtifactLookup.notFound() : artifactDirectory.lookup(name);

    switch (lookup.status()) {
      case FORBIDDEN:
        LOGGER.warn("Denied access outside download directory: {}", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .contentType(TEXT_PLAIN_UTF8)
            .body("Access denied");
      case NOT_FOUND:
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .contentType(TEXT_PLAIN_UTF8)
            .body("File not found");
      default:
        break;
    }

    FileSystemResource resource = new FileSystemResource(lookup.path());
    String fileName = lookup.path().getFileName().toString();
    LOGGER.info("Serving {}", fileName);

    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDispositions.attachment(fileName))
        .contentType(
            MediaTypeFactory.getMediaType(fileName).orElse(MediaType.APPLICATION_OCTET_STREAM))
        .body(resource);
  }

  /** The percent-decoded remainder of the request path, or null if it cannot be decoded. */
  private static String requestedName(HttpServletRequest request) {
    String prefix = request.getContextPath() + DOWNLOAD_PREFIX;
    String uri = request.getRequestURI();
    if (!uri.startsWith(prefix)) {
      return null;
    }
    try {
      return UriUtils.decode(uri.substring(prefix.length()), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      LOGGER.debug("Malformed file name in {}: {}", uri, e.getMessage());
      return null;
    }
  }
}
