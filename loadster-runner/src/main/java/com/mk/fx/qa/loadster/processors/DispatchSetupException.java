package com.mk.fx.qa.loadster.processors;

/** The run could not start: the HTTP client or the request could not be constructed. */
public class DispatchSetupException extends RuntimeException {

  public DispatchSetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
