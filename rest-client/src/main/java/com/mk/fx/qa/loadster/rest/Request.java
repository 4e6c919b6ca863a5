package com.mk.fx.qa.loadster.rest;

import java.util.List;
import lombok.Data;

@Data
public class Request {
  private HttpMethod method;
  private String url;
  private List<Header> headers;
  private String body;
}
