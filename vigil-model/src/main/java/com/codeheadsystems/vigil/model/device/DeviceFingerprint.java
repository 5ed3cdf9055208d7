package com.codeheadsystems.vigil.model.device;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * A derived device identifier together with the signals it was computed from.
 *
 * @param id         hex-encoded hash of the stable signals and the configured salt
 * @param signals    the raw signals
 * @param confidence weighted share of signals that were present and non-degenerate, in [0,1]
 * @param createdAt  generation time
 */
public record DeviceFingerprint(
    @JsonProperty("id") String id,
    @JsonProperty("signals") DeviceSignals signals,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("createdAt") Instant createdAt) {

  public DeviceFingerprint {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(signals, "signals");
    if (confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
    }
  }
}
