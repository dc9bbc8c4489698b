package com.scholary.video.fetcher.token;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;

/**
 * Maps short keys to full video links.
 *
 * <p>Callback payloads in chat front ends are limited to a few dozen bytes, so a link is referenced
 * by the first ten hex digits of its MD5 digest instead. The same link always yields the same key.
 *
 * <p>The store is bounded. When it is full, the older half of the entries (by insertion order) is
 * dropped before a new key is added. Keys that are looked up after eviction are simply absent and
 * the caller must ask the user to send the link again.
 *
 * <p>Thread-safe: request threads put and look up concurrently.
 */
public class LinkTokenStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LinkTokenStore.class);

  static final int KEY_LENGTH = 10;

  private final int capacity;
  private final Map<String, String> links = new LinkedHashMap<>();

  public LinkTokenStore(int capacity) {
    if (capacity < 2) {
      throw new IllegalArgumentException("Capacity must be at least 2, was " + capacity);
    }
    this.capacity = capacity;
  }

  /**
   * Store a link and return its key.
   *
   * <p>Storing a link that is already present returns the existing key and leaves the entry where
   * it is in the eviction order.
   *
   * @param url the full link
   * @return the short key for the link
   */
  public synchronized String put(String url) {
    String key = keyFor(url);
    if (links.containsKey(key)) {
      return key;
    }
    if (links.size() >= capacity) {
      evictOldestHalf();
    }
    links.put(key, url);
    return key;
  }

  /**
   * Look up a link by key.
   *
   * @param key the short key
   * @return the link, or empty if the key is unknown or was evicted
   */
  public synchronized Optional<String> get(String key) {
    return Optional.ofNullable(links.get(key));
  }

  public synchronized int size() {
    return links.size();
  }

  /** Derive the key for a link without storing it. */
  public static String keyFor(String url) {
    return DigestUtils.md5DigestAsHex(url.getBytes(StandardCharsets.UTF_8))
        .substring(0, KEY_LENGTH);
  }

  private void evictOldestHalf() {
    int toEvict = links.size() / 2;
    Iterator<String> keys = links.keySet().iterator();
    for (int i = 0; i < toEvict && keys.hasNext(); i++) {
      keys.next();
      keys.remove();
    }
    LOGGER.debug("Evicted {} oldest links, {} remain", toEvict, links.size());
  }
}
