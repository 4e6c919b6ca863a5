package com.mk.fx.qa.loadster.rest;

import java.util.Arrays;

/** HTTP methods a load run may issue. */
public enum HttpMethod {
  GET(false),
  POST(true),
  PUT(true),
  DELETE(false),
  PATCH(true);

  private final boolean carriesBody;

  HttpMethod(boolean carriesBody) {
    this.carriesBody = carriesBody;
  }

  /** Whether a request body is sent with this method. */
  public boolean carriesBody() {
    return carriesBody;
  }

  public static HttpMethod fromValue(String value) {
    return Arrays.stream(values())
        .filter(method -> method.name().equalsIgnoreCase(value == null ? "" : value.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("'" + value + "' is not a valid HTTP method"));
  }
}
