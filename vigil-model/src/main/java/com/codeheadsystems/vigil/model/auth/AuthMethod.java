package com.codeheadsystems.vigil.model.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The authentication methods, in their default fallback order.
 */
public enum AuthMethod {
  /**
   * Hardware-backed platform assertion (biometric or security key).
   */
  PLATFORM("platform"),
  /**
   * Numeric PIN verified against a salted hash.
   */
  PIN("pin"),
  /**
   * One-time code delivered by SMS.
   */
  SMS("sms"),
  /**
   * Approval request delivered to a registered device.
   */
  PUSH("push");

  private final String wireName;

  AuthMethod(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a method from its lower-case wire name.
   *
   * @param wireName the wire name, e.g. {@code "pin"}
   * @return the method
   * @throws IllegalArgumentException if the name is unknown
   */
  @JsonCreator
  public static AuthMethod fromWireName(String wireName) {
    for (AuthMethod method : values()) {
      if (method.wireName.equalsIgnoreCase(wireName)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unknown auth method: " + wireName);
  }
}
