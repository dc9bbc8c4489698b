package com.scholary.video.fetcher.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LinkTokenStoreTest {

  private LinkTokenStore store;

  @BeforeEach
  void setUp() {
    store = new LinkTokenStore(100);
  }

  @Test
  void put_shouldReturnKeyThatResolvesToUrl() {
    String key = store.put("https://youtu.be/abc123");

    assertThat(key).hasSize(LinkTokenStore.KEY_LENGTH).matches("[0-9a-f]+");
    assertThat(store.get(key)).contains("https://youtu.be/abc123");
  }

  @Test
  void put_shouldReturnSameKeyForSameUrl() {
    String first = store.put("https://youtu.be/abc123");
    String second = store.put("https://youtu.be/abc123");

    assertThat(second).isEqualTo(first);
    assertThat(first).isEqualTo(LinkTokenStore.keyFor("https://youtu.be/abc123"));
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void put_shouldReturnDifferentKeysForDifferentUrls() {
    assertThat(store.put("https://youtu.be/one")).isNotEqualTo(store.put("https://youtu.be/two"));
  }

  @Test
  void get_shouldBeEmptyForUnknownKey() {
    assertThat(store.get("0123456789")).isEmpty();
  }

  @Test
  void put_shouldEvictOldestHalfWhenFull() {
    List<String> keys = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      keys.add(store.put("https://youtu.be/video" + i));
    }
    assertThat(store.size()).isEqualTo(100);

    String newest = store.put("https://youtu.be/video100");

    assertThat(store.size()).isLessThanOrEqualTo(100);
    assertThat(store.get(newest)).contains("https://youtu.be/video100");
    for (int i = 0; i < 50; i++) {
      assertThat(store.get(keys.get(i))).as("entry %d", i).isEmpty();
    }
    for (int i = 50; i < 100; i++) {
      assertThat(store.get(keys.get(i))).as("entry %d", i).isPresent();
    }
  }

  @Test
  void put_shouldNeverExceedCapacity() {
    for (int i = 0; i < 1000; i++) {
      store.put("https://youtu.be/video" + i);
      assertThat(store.size()).isLessThanOrEqualTo(100);
    }
  }

  @Test
  void put_shouldNotEvictWhenKnownUrlIsStoredAgainAtCapacity() {
    for (int i = 0; i < 100; i++) {
      store.put("https://youtu.be/video" + i);
    }

    store.put("https://youtu.be/video0");

    assertThat(store.size()).isEqualTo(100);
  }

  @Test
  void constructor_shouldRejectTinyCapacity() {
    assertThatThrownBy(() -> new LinkTokenStore(1)).isInstanceOf(IllegalArgumentException.class);
  }
}
