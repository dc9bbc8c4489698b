package com.scholary.video.fetcher.fileserver;

import com.scholary.video.fetcher.config.DownloadProperties;
import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * Builds the links users open to fetch their files.
 *
 * <p>The file server is meant for the local network, so by default links point at this machine's
 * LAN address. A configured {@code fetcher.publicBaseUrl} takes precedence.
 */
@Component
public class DownloadLinkBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadLinkBuilder.class);

  private final String publicBaseUrl;
  private final int port;

  public DownloadLinkBuilder(
      DownloadProperties properties, @Value("${server.port:8080}") int port) {
    this.publicBaseUrl = properties.publicBaseUrl();
    this.port = port;
  }

  /** Address of the file listing page. */
  public String baseUrl() {
    if (publicBaseUrl != null && !publicBaseUrl.isBlank()) {
      return publicBaseUrl.endsWith("/")
          ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
          : publicBaseUrl;
    }
    return "http://" + localAddress() + ":" + port;
  }

  /** Link that downloads the given artifact. */
  public String downloadUrl(String fileName) {
    return baseUrl() + "/download/" + UriUtils.encodePathSegment(fileName, StandardCharsets.UTF_8);
  }

  /**
   * Find the address other machines on the LAN reach us at.
   *
   * <p>Connecting a UDP socket sends nothing; it only makes the OS pick the outbound interface.
   */
  static String localAddress() {
    try (DatagramSocket socket = new DatagramSocket()) {
      socket.connect(InetAddress.getByName("8.8.8.8"), 80);
      InetAddress address = socket.getLocalAddress();
      if (address == null || address.isAnyLocalAddress()) {
        return "localhost";
      }
      return address.getHostAddress();
    } catch (IOException e) {
      LOGGER.debug("Could not determine LAN address, using localhost: {}", e.getMessage());
      return "localhost";
    }
  }
}
