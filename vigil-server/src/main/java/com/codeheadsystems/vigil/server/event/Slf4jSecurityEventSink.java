package com.codeheadsystems.vigil.server.event;

import com.codeheadsystems.vigil.model.event.SecurityEventRecord;
import com.codeheadsystems.vigil.server.exception.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as one JSON line to the {@value #AUDIT_LOGGER} logger; route that logger to
 * durable storage in the logging configuration.
 */
public class Slf4jSecurityEventSink implements SecurityEventSink {

  public static final String AUDIT_LOGGER = "vigil.security.audit";

  private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

  private final ObjectMapper mapper;

  public Slf4jSecurityEventSink() {
    this(new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
  }

  public Slf4jSecurityEventSink(final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public void record(SecurityEventRecord event) {
    try {
      audit.info(mapper.writeValueAsString(event));
    } catch (JsonProcessingException e) {
      throw new ProviderException("Unable to serialize security event " + event.kind(), e);
    }
  }
}
