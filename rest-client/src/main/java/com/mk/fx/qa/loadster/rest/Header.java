package com.mk.fx.qa.loadster.rest;

import java.util.Objects;

/**
 * A single request header. Order and duplicates are preserved by whoever holds a list of these.
 *
 * @param name header name
 * @param value header value
 */
public record Header(String name, String value) {

  public Header {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String toString() {
    return name + ": " + value;
  }
}
