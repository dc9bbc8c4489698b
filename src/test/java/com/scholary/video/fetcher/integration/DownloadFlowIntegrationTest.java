package com.scholary.video.fetcher.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.scholary.video.fetcher.api.AsyncJobResponse;
import com.scholary.video.fetcher.api.ErrorResponse;
import com.scholary.video.fetcher.api.JobRequest;
import com.scholary.video.fetcher.api.JobStatusResponse;
import com.scholary.video.fetcher.api.LinkRequest;
import com.scholary.video.fetcher.api.LinkResponse;
import com.scholary.video.fetcher.api.QualityChoice;
import com.scholary.video.fetcher.api.ServerInfoResponse;
import com.scholary.video.fetcher.extraction.DownloadSpec;
import com.scholary.video.fetcher.extraction.ExtractedMedia;
import com.scholary.video.fetcher.extraction.ExtractionFailedException;
import com.scholary.video.fetcher.extraction.ExtractionPort;
import com.scholary.video.fetcher.extraction.ProgressEvent;
import com.scholary.video.fetcher.extraction.ProgressEvent.Status;
import com.scholary.video.fetcher.extraction.ProgressHook;
import com.scholary.video.fetcher.extraction.VideoInfo;
import com.scholary.video.fetcher.job.JobStatus;
import com.scholary.video.fetcher.progress.Phase;
import com.scholary.video.fetcher.token.LinkTokenStore;
import com.scholary.video.fetcher.transcode.Transcoder;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * End-to-end test of the download flow: submit a link, pick a quality, poll the job and fetch the
 * file from the file server.
 *
 * <p>The extraction engine and re-encoder are mocked; everything else runs for real, including the
 * worker pool and the progress scheduler.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class DownloadFlowIntegrationTest {

  private static final String URL = "https://youtu.be/abc123";
  private static final Path DOWNLOAD_DIR = createDownloadDir();

  @Autowired private TestRestTemplate restTemplate;

  @LocalServerPort private int port;

  @MockBean private ExtractionPort extractionPort;
  @MockBean private Transcoder transcoder;

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    registry.add("fetcher.downloadDir", DOWNLOAD_DIR::toString);
    registry.add("fetcher.publicBaseUrl", () -> "http://files.test");
    registry.add("fetcher.progressInterval", () -> "50ms");
  }

  private static Path createDownloadDir() {
    try {
      return Files.createTempDirectory("video-fetcher-it");
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Test
  void linkToDownload_shouldProduceServableFile() throws Exception {
    when(extractionPort.probe(eq(URL), any()))
        .thenReturn(new VideoInfo("Integration Title", 212, "Uploader", null));
    when(extractionPort.download(any(), any(), any()))
        .thenAnswer(
            invocation -> {
              DownloadSpec spec = invocation.getArgument(0);
              ProgressHook hook = invocation.getArgument(2);
              hook.onProgress(new ProgressEvent(Status.DOWNLOADING, 10, 100, 0));
              hook.onProgress(new ProgressEvent(Status.FINISHED, 100, 100, 0));
              Path file =
                  Path.of(spec.outputTemplate()).resolveSibling("Integration Title.mp4");
              Files.write(file, new byte[4096]);
              return new ExtractedMedia(file, "avc1.64001F");
            });

    ResponseEntity<LinkResponse> link =
        restTemplate.postForEntity(
            "/api/links", new LinkRequest("have a look: youtu.be/abc123"), LinkResponse.class);

    assertThat(link.getStatusCode()).isEqualTo(HttpStatus.OK);
    LinkResponse menu = link.getBody();
    assertThat(menu.key()).isEqualTo(LinkTokenStore.keyFor(URL));
    assertThat(menu.title()).isEqualTo("Integration Title");
    assertThat(menu.duration()).isEqualTo("3:32");
    assertThat(menu.choices())
        .extracting(QualityChoice::callbackData)
        .containsExactly(
            "best|" + menu.key(),
            "720p|" + menu.key(),
            "480p|" + menu.key(),
            "audio|" + menu.key());

    ResponseEntity<AsyncJobResponse> started =
        restTemplate.postForEntity(
            "/api/jobs", new JobRequest(menu.key(), "720p"), AsyncJobResponse.class);
    assertThat(started.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

    JobStatusResponse status = awaitFinished(started.getBody().jobId());

    assertThat(status.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(status.phase()).isEqualTo(Phase.DONE);
    assertThat(status.fileName()).isEqualTo("Integration Title.mp4");
    assertThat(status.downloadUrl())
        .isEqualTo("http://files.test/download/Integration%20Title.mp4");
    assertThat(status.message()).startsWith("Ready to download!");

    ResponseEntity<byte[]> file =
        restTemplate.getForEntity("/download/Integration Title.mp4", byte[].class);
    assertThat(file.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(file.getBody()).hasSize(4096);
    assertThat(file.getHeaders().getFirst("Content-Disposition"))
        .startsWith("attachment; filename=\"Integration Title.mp4\"");

    String listing = restTemplate.getForObject("/", String.class);
    assertThat(listing).contains("Integration Title.mp4");
  }

  @Test
  void failedDownload_shouldReportErrorOnJob() throws Exception {
    String url = "https://youtu.be/broken1";
    when(extractionPort.download(any(), any(), any()))
        .thenThrow(new ExtractionFailedException("Video unavailable"));
    String key = submitLink(url);

    ResponseEntity<AsyncJobResponse> started =
        restTemplate.postForEntity(
            "/api/jobs", new JobRequest(key, "best"), AsyncJobResponse.class);
    JobStatusResponse status = awaitFinished(started.getBody().jobId());

    assertThat(status.status()).isEqualTo(JobStatus.FAILED);
    assertThat(status.error()).isEqualTo("Video unavailable");
    assertThat(status.message()).isEqualTo("Download failed: Video unavailable");
  }

  @Test
  void unknownKey_shouldAskForTheLinkAgain() {
    ResponseEntity<ErrorResponse> response =
        restTemplate.postForEntity(
            "/api/jobs", new JobRequest("0000000000", "720p"), ErrorResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GONE);
    assertThat(response.getBody().message()).isEqualTo("Link expired. Please send the URL again.");
  }

  @Test
  void textWithoutLink_shouldBeRejected() {
    ResponseEntity<ErrorResponse> response =
        restTemplate.postForEntity(
            "/api/links", new LinkRequest("no video here"), ErrorResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().message()).isEqualTo("Please send a valid YouTube link.");
  }

  @Test
  void probeFailure_shouldBeReportedAsBadGateway() {
    when(extractionPort.probe(any(), any()))
        .thenThrow(new ExtractionFailedException("Private video"));

    ResponseEntity<ErrorResponse> response =
        restTemplate.postForEntity(
            "/api/links", new LinkRequest("https://youtu.be/private1"), ErrorResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(response.getBody().message())
        .isEqualTo("Error fetching video info: Private video");
  }

  @Test
  void unknownJob_shouldBeNotFound() {
    ResponseEntity<String> response =
        restTemplate.getForEntity("/api/jobs/does-not-exist", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void serverInfo_shouldPointAtFileServer() {
    ServerInfoResponse info = restTemplate.getForObject("/api/server", ServerInfoResponse.class);

    assertThat(info.browseUrl()).isEqualTo("http://files.test");
  }

  @Test
  void encodedTraversal_shouldBeForbiddenOnTheWire() throws Exception {
    Path outside =
        Files.writeString(DOWNLOAD_DIR.resolveSibling(DOWNLOAD_DIR.getFileName() + ".secret"), "s");
    try {
      assertThat(rawStatus("/download/..%2F..%2Fetc%2Fpasswd")).isEqualTo(403);
      assertThat(rawStatus("/download/..%2F" + outside.getFileName())).isEqualTo(403);
      assertThat(rawStatus("/download/..%2Fmissing.mp4")).isEqualTo(403);
      assertThat(rawStatus("/download/missing.mp4")).isEqualTo(404);
    } finally {
      Files.deleteIfExists(outside);
    }
  }

  // Sent as-is so the client does not re-encode or normalize the path
  private int rawStatus(String rawPath) throws IOException {
    HttpURLConnection connection =
        (HttpURLConnection) new URL("http://localhost:" + port + rawPath).openConnection();
    try {
      return connection.getResponseCode();
    } finally {
      connection.disconnect();
    }
  }

  private String submitLink(String url) {
    when(extractionPort.probe(eq(url), any()))
        .thenReturn(new VideoInfo(VideoInfo.UNKNOWN, 0, VideoInfo.UNKNOWN, null));
    return restTemplate
        .postForEntity("/api/links", new LinkRequest(url), LinkResponse.class)
        .getBody()
        .key();
  }

  private JobStatusResponse awaitFinished(String jobId) throws InterruptedException {
    Instant deadline = Instant.now().plus(Duration.ofSeconds(10));
    JobStatusResponse status;
    do {
      Thread.sleep(50);
      status = restTemplate.getForObject("/api/jobs/" + jobId, JobStatusResponse.class);
    } while (status.status() != JobStatus.COMPLETED
        && status.status() != JobStatus.FAILED
        && Instant.now().isBefore(deadline));
    return status;
  }
}
