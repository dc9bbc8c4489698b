package com.scholary.video.fetcher.token;

/**
 * Thrown when a link key is no longer in the token store.
 *
 * <p>This is an expected condition, not a fault: the store is bounded and old keys are evicted.
 * The user has to send the link again.
 */
public class LinkExpiredException extends RuntimeException {

  private final String key;

  public LinkExpiredException(String key) {
    super("Link expired: " + key);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
