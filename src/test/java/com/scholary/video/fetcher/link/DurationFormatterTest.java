package com.scholary.video.fetcher.link;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.Test;

class DurationFormatterTest {

  @Test
  void format_shouldUseMinutesBelowAnHour() {
    assertThat(DurationFormatter.format(5)).isEqualTo("0:05");
    assertThat(DurationFormatter.format(212)).isEqualTo("3:32");
    assertThat(DurationFormatter.format(3599)).isEqualTo("59:59");
  }

  @Test
  void format_shouldUseHoursFromAnHourOn() {
    assertThat(DurationFormatter.format(3600)).isEqualTo("1:00:00");
    assertThat(DurationFormatter.format(3723)).isEqualTo("1:02:03");
  }

  @Test
  void format_shouldReportUnknownDuration() {
    assertThat(DurationFormatter.format(0)).isEqualTo("Unknown");
    assertThat(DurationFormatter.format(-1)).isEqualTo("Unknown");
  }

  @Test
  void format_shouldUseAsciiDigitsWhateverTheDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
    try {
      assertThat(DurationFormatter.format(212)).isEqualTo("3:32");
      assertThat(DurationFormatter.format(3723)).isEqualTo("1:02:03");
    } finally {
      Locale.setDefault(previous);
    }
  }
}
