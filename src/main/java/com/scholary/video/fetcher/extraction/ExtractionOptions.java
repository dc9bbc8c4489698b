package com.scholary.video.fetcher.extraction;

import java.util.List;

/**
 * Environment-specific extraction settings, passed through to the engine untouched.
 *
 * <p>Both fields are optional. {@code cookiesFromBrowser} names a local browser profile to read
 * cookies from; {@code remoteComponents} lists extra engine components to enable.
 */
public record ExtractionOptions(String cookiesFromBrowser, List<String> remoteComponents) {

  public ExtractionOptions {
    remoteComponents = remoteComponents == null ? List.of() : List.copyOf(remoteComponents);
  }

  public static ExtractionOptions none() {
    return new ExtractionOptions(null, List.of());
  }

  public boolean hasCookiesFromBrowser() {
    return cookiesFromBrowser != null && !cookiesFromBrowser.isBlank();
  }
}
