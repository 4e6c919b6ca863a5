package com.mk.fx.qa.loadster.rest;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeadersTest {

  @Test
  void parse_keepsOrderAndDuplicates() {
    var parsed = Headers.parse(List.of("X-Trace: a", "Accept: text/plain", "X-Trace: b"));

    assertThat(parsed)
        .containsExactly(
            new Header("X-Trace", "a"), new Header("Accept", "text/plain"), new Header("X-Trace", "b"));
  }

  @Test
  void parse_skipsEntriesWithoutColonOrName() {
    var parsed = Headers.parse(Arrays.asList("no-colon-here", ": orphan", null, "Authorization: Bearer x"));

    assertThat(parsed).containsExactly(new Header("Authorization", "Bearer x"));
  }

  @Test
  void parse_splitsOnFirstColonOnly() {
    var parsed = Headers.parse(List.of("Referer: http://example.test:8080/path"));

    assertThat(parsed).containsExactly(new Header("Referer", "http://example.test:8080/path"));
  }

  @Test
  void parse_allowsEmptyValue() {
    assertThat(Headers.parse(List.of("X-Empty:"))).containsExactly(new Header("X-Empty", ""));
  }

  @Test
  void parse_nullOrEmpty_returnsEmptyList() {
    assertThat(Headers.parse(null)).isEmpty();
    assertThat(Headers.parse(List.of())).isEmpty();
  }
}
