package com.mk.fx.qa.loadster.rest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Parses {@code "Name: Value"} strings into {@link Header} entries. */
@Slf4j
public final class Headers {

  private Headers() {
    // Utility class, no instantiation
  }

  /**
   * Parses raw header strings, keeping their order. Entries without a colon, or with nothing before
   * the colon, are skipped. Only the first colon separates name from value.
   *
   * @param raw raw header strings, may be null
   * @return the parsed headers, never null
   */
  public static List<Header> parse(Collection<String> raw) {
    if (raw == null || raw.isEmpty()) {
      return List.of();
    }
    List<Header> parsed = new ArrayList<>(raw.size());
    for (String entry : raw) {
      if (entry == null) {
        continue;
      }
      int colon = entry.indexOf(':');
      if (colon < 0) {
        log.debug("Skipping malformed header '{}'", entry);
        continue;
      }
      var name = entry.substring(0, colon).trim();
      if (name.isEmpty()) {
        log.debug("Skipping header with empty name '{}'", entry);
        continue;
      }
      parsed.add(new Header(name, entry.substring(colon + 1).trim()));
    }
    return List.copyOf(parsed);
  }
}
