package com.codeheadsystems.vigil.server.event;

import com.codeheadsystems.vigil.model.event.SecurityEventRecord;

/**
 * Durable audit trail. Fire-and-forget from the engine's point of view: a failing sink is
 * logged by the caller and never changes an authentication outcome.
 */
public interface SecurityEventSink {

  /**
   * Records an event.
   *
   * @param event the event
   * @throws com.codeheadsystems.vigil.server.exception.ProviderException if it cannot be recorded
   */
  void record(SecurityEventRecord event);
}
