package com.codeheadsystems.vigil.model.auth;

import com.codeheadsystems.vigil.model.device.DeviceSignals;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * A request to authenticate an identity with one method.
 *
 * @param identity      who is authenticating
 * @param method        the method to try, null to start at the head of the fallback chain
 * @param credential    the PIN or one-time code, null for methods that need none
 * @param deviceSignals signals reported by the device, null if none were collected
 * @param attributes    request context such as the remote address, passed to fraud checks
 * @param timeout       how long a platform assertion or push approval may take for this
 *                      attempt, null for the configured default
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthRequest(
    @JsonProperty("identity") AuthIdentity identity,
    @JsonProperty("method") AuthMethod method,
    @JsonProperty("credential") String credential,
    @JsonProperty("deviceSignals") DeviceSignals deviceSignals,
    @JsonProperty("attributes") Map<String, String> attributes,
    @JsonProperty("timeout") Duration timeout) {

  public AuthRequest {
    Objects.requireNonNull(identity, "identity");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }
  }

  public static AuthRequest of(AuthIdentity identity, AuthMethod method, String credential) {
    return new AuthRequest(identity, method, credential, null, Map.of(), null);
  }

  public AuthRequest withMethod(AuthMethod newMethod) {
    return new AuthRequest(identity, newMethod, credential, deviceSignals, attributes, timeout);
  }

  public AuthRequest withDeviceSignals(DeviceSignals signals) {
    return new AuthRequest(identity, method, credential, signals, attributes, timeout);
  }

  public AuthRequest withTimeout(Duration newTimeout) {
    return new AuthRequest(identity, method, credential, deviceSignals, attributes, newTimeout);
  }

  /**
   * The timeout for this attempt, falling back to a default.
   *
   * @param fallback the configured default
   * @return the timeout to apply
   */
  public Duration timeoutOr(Duration fallback) {
    return timeout != null ? timeout : fallback;
  }

  @Override
  public String toString() {
    return "AuthRequest[identity=" + identity + ", method=" + method
        + ", credential=" + (credential == null ? "null" : "***") + "]";
  }
}
