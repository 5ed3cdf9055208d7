package com.codeheadsystems.vigil.model.event;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One append-only audit entry.
 *
 * @param identity            the identity concerned
 * @param kind                what happened
 * @param method              the method involved, null for method-independent events
 * @param timestamp           when it happened
 * @param riskScore           device risk score of the attempt, null if no fingerprint was given
 * @param deviceFingerprintId fingerprint id of the attempt, null if none was given
 * @param metadata            additional string attributes, never secrets
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecurityEventRecord(
    @JsonProperty("identity") AuthIdentity identity,
    @JsonProperty("kind") SecurityEventKind kind,
    @JsonProperty("method") AuthMethod method,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("riskScore") Double riskScore,
    @JsonProperty("deviceFingerprintId") String deviceFingerprintId,
    @JsonProperty("metadata") Map<String, String> metadata) {

  public SecurityEventRecord {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(timestamp, "timestamp");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
