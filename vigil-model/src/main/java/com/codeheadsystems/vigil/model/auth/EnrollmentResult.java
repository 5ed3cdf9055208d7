package com.codeheadsystems.vigil.model.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of enrolling a PIN or a platform credential.
 *
 * @param method    the enrolled method
 * @param success   whether the credential was stored
 * @param errorKind failure reason, null on success
 * @param message   short human-readable explanation, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnrollmentResult(
    @JsonProperty("method") AuthMethod method,
    @JsonProperty("success") boolean success,
    @JsonProperty("errorKind") ErrorKind errorKind,
    @JsonProperty("message") String message) {

  public static EnrollmentResult enrolled(AuthMethod method) {
    return new EnrollmentResult(method, true, null, null);
  }

  public static EnrollmentResult rejected(AuthMethod method, ErrorKind errorKind, String message) {
    return new EnrollmentResult(method, false, errorKind, message);
  }
}
