package com.codeheadsystems.vigil.server.verifier;

/**
 * Assertion returned by a platform authenticator.
 *
 * @param credentialId the credential that signed
 * @param challenge    the challenge as echoed by the authenticator
 */
public record PlatformAssertion(String credentialId, byte[] challenge) {
}
