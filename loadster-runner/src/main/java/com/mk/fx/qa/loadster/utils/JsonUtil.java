package com.mk.fx.qa.loadster.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mk.fx.qa.loadster.cfg.ObjectMapperConfig;

public final class JsonUtil {

  private static final ObjectMapper MAPPER = ObjectMapperConfig.buildMapper();
  private static final ObjectWriter SINGLE_LINE = MAPPER.writer().without(SerializationFeature.INDENT_OUTPUT);

  private JsonUtil() {
    // Utility class, no instantiation
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static String toJson(Object value) throws JsonProcessingException {
    return MAPPER.writeValueAsString(value);
  }

  /** Serialises without indentation, suitable for newline-delimited output. */
  public static String toJsonLine(Object value) throws JsonProcessingException {
    return SINGLE_LINE.writeValueAsString(value);
  }
}
