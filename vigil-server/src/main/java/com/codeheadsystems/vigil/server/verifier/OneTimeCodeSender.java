package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;

/**
 * Delivers one-time codes out of band, typically through an SMS gateway.
 */
public interface OneTimeCodeSender {

  /**
   * Sends a code.
   *
   * @param identity    the identity
   * @param phoneNumber destination
   * @param code        the digits
   * @return true if the gateway accepted the message
   * @throws com.codeheadsystems.vigil.server.exception.ProviderException on gateway failure
   */
  boolean send(AuthIdentity identity, String phoneNumber, String code);
}
