package com.mk.fx.qa.loadster.rest;

/** Raised when a single call could not obtain a response (timeout, refused connection, TLS...). */
public class RestClientException extends RuntimeException {

  public RestClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
