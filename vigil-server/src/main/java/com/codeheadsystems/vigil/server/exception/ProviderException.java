package com.codeheadsystems.vigil.server.exception;

/**
 * Thrown by store, SMS and push provider implementations on infrastructure failure. The engine
 * catches it at the provider boundary and reports {@code PROVIDER_FAILURE}.
 */
public class ProviderException extends RuntimeException {

  /**
   * Instantiates a new Provider exception.
   *
   * @param message the message
   */
  public ProviderException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Provider exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ProviderException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
