package com.codeheadsystems.vigil.server.config;

import com.codeheadsystems.vigil.model.auth.AuthMethod;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered list of authentication methods tried in turn until one succeeds.
 *
 * @param methods the methods, non-empty and without duplicates
 */
public record FallbackChain(List<AuthMethod> methods) {

  public static final FallbackChain DEFAULT =
      of(AuthMethod.PLATFORM, AuthMethod.PIN, AuthMethod.SMS, AuthMethod.PUSH);

  public FallbackChain {
    if (methods == null || methods.isEmpty()) {
      throw new IllegalArgumentException("fallback chain must not be empty");
    }
    methods = List.copyOf(methods);
    Set<AuthMethod> seen = EnumSet.noneOf(AuthMethod.class);
    for (AuthMethod method : methods) {
      if (!seen.add(method)) {
        throw new IllegalArgumentException("duplicate method in fallback chain: " + method);
      }
    }
  }

  public static FallbackChain of(AuthMethod... methods) {
    return new FallbackChain(List.of(methods));
  }

  public AuthMethod first() {
    return methods.get(0);
  }

  public boolean contains(AuthMethod method) {
    return methods.contains(method);
  }

  /**
   * The method to fall back to after {@code current} failed.
   *
   * @param current the failed method
   * @return the next method, or empty if the chain is exhausted or does not contain
   *     {@code current}
   */
  public Optional<AuthMethod> next(AuthMethod current) {
    int index = methods.indexOf(current);
    if (index < 0 || index + 1 >= methods.size()) {
      return Optional.empty();
    }
    return Optional.of(methods.get(index + 1));
  }
}
