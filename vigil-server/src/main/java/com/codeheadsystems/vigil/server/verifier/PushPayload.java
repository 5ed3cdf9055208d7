package com.codeheadsystems.vigil.server.verifier;

import java.time.Instant;
import java.util.Map;

/**
 * Content of a push approval request.
 *
 * @param challengeToken token the device returns with its answer
 * @param title          notification title
 * @param body           notification body
 * @param expiresAt      when the request stops being answerable
 * @param data           additional key/values for the device
 */
public record PushPayload(String challengeToken,
                          String title,
                          String body,
                          Instant expiresAt,
                          Map<String, String> data) {

  public PushPayload {
    data = data == null ? Map.of() : Map.copyOf(data);
  }
}
