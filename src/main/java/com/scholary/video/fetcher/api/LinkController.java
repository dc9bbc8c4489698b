package com.scholary.video.fetcher.api;

import com.scholary.video.fetcher.extraction.ExtractionFailedException;
import com.scholary.video.fetcher.extraction.ExtractionOptions;
import com.scholary.video.fetcher.extraction.ExtractionPort;
import com.scholary.video.fetcher.extraction.VideoInfo;
import com.scholary.video.fetcher.fileserver.DownloadLinkBuilder;
import com.scholary.video.fetcher.job.Quality;
import com.scholary.video.fetcher.link.DurationFormatter;
import com.scholary.video.fetcher.link.YoutubeLinkDetector;
import com.scholary.video.fetcher.token.LinkTokenStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for submitting links.
 *
 * <p>This is the first half of the chat flow: the user sends a message, we find the video link in
 * it, fetch its details and offer the quality menu. The link itself is kept in the token store and
 * only its short key travels in the menu's callback data.
 */
@RestController
@Tag(name = "Links", description = "Submit video links and get the quality menu")
public class LinkController {

  private static final Logger LOGGER = LoggerFactory.getLogger(LinkController.class);

  private final ExtractionPort extractionPort;
  private final ExtractionOptions extractionOptions;
  private final LinkTokenStore tokenStore;
  private final DownloadLinkBuilder linkBuilder;

  public LinkController(
      ExtractionPort extractionPort,
      ExtractionOptions extractionOptions,
      LinkTokenStore tokenStore,
      DownloadLinkBuilder linkBuilder) {
    this.extractionPort = extractionPort;
    this.extractionOptions = extractionOptions;
    this.tokenStore = tokenStore;
    this.linkBuilder = linkBuilder;
  }

  @PostMapping("/api/links")
  @Operation(
      summary = "Submit a link",
      description = "Find a YouTube link in the text and return its details and quality menu")
  public ResponseEntity<?> submitLink(@Valid @RequestBody LinkRequest request) {
    Optional<String> url = YoutubeLinkDetector.find(request.text());
    if (url.isEmpty()) {
      return ResponseEntity.badRequest()
          .body(new ErrorResponse("Please send a valid YouTube link."));
    }

    VideoInfo info;
    try {
      info = extractionPort.probe(url.get(), extractionOptions);
    } catch (ExtractionFailedException e) {
      LOGGER.error("Error fetching video info for {}: {}", url.get(), e.getMessage());
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
          .body(new ErrorResponse("Error fetching video info: " + e.getMessage()));
    }

    String key = tokenStore.put(url.get());
    List<QualityChoice> choices =
        Arrays.stream(Quality.values())
            .map(
                quality ->
                    new QualityChoice(quality.code(), quality.label(), quality.code() + "|" + key))
            .toList();

    LOGGER.info("Link accepted: key={}, title={}", key, info.title());
    return ResponseEntity.ok(
        new LinkResponse(
            key,
            url.get(),
            info.title(),
            DurationFormatter.format(info.durationSeconds()),
            info.uploader(),
            info.thumbnailUrl(),
            choices));
  }

  @GetMapping("/api/server")
  @Operation(summary = "File server address", description = "Where to browse all downloads")
  public ServerInfoResponse serverInfo() {
    return new ServerInfoResponse(linkBuilder.baseUrl());
  }
}
