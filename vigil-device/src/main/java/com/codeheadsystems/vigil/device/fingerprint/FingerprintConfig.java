package com.codeheadsystems.vigil.device.fingerprint;

import com.codeheadsystems.vigil.device.signal.SignalCategory;
import java.util.Objects;

/**
 * Configuration for {@link DeviceFingerprintGenerator}.
 * <p>
 * The cheap probes (user agent, screen, timezone, languages, platform, hardware, plugins) are
 * always collected. The expensive or intrusive ones can be switched off; a disabled probe is
 * never called and its category counts as absent.
 *
 * @param salt                fixed salt mixed into every fingerprint id
 * @param renderEngineEnabled collect rendering-engine vendor and renderer
 * @param canvasEnabled       collect the canvas digest
 * @param audioEnabled        collect the audio digest
 * @param fontsEnabled        collect the font list
 * @param networkEnabled      collect network-type hints
 * @param powerEnabled        collect power-source hints
 * @param cacheEnabled        reuse the last generated fingerprint
 */
public record FingerprintConfig(String salt,
                                boolean renderEngineEnabled,
                                boolean canvasEnabled,
                                boolean audioEnabled,
                                boolean fontsEnabled,
                                boolean networkEnabled,
                                boolean powerEnabled,
                                boolean cacheEnabled) {

  public static final String DEFAULT_SALT = "vigil-fingerprint-salt";

  /**
   * All probes enabled, caching on.
   */
  public static final FingerprintConfig DEFAULT =
      new FingerprintConfig(DEFAULT_SALT, true, true, true, true, true, true, true);

  public FingerprintConfig {
    Objects.requireNonNull(salt, "salt");
    if (salt.isEmpty()) {
      throw new IllegalArgumentException("salt must not be empty");
    }
  }

  public FingerprintConfig withSalt(String newSalt) {
    return new FingerprintConfig(newSalt, renderEngineEnabled, canvasEnabled, audioEnabled,
        fontsEnabled, networkEnabled, powerEnabled, cacheEnabled);
  }

  public FingerprintConfig withCacheEnabled(boolean enabled) {
    return new FingerprintConfig(salt, renderEngineEnabled, canvasEnabled, audioEnabled,
        fontsEnabled, networkEnabled, powerEnabled, enabled);
  }

  /**
   * Whether the probe for the given category should be called.
   *
   * @param category the category
   * @return true if enabled
   */
  public boolean isEnabled(SignalCategory category) {
    return switch (category) {
      case RENDER_ENGINE -> renderEngineEnabled;
      case CANVAS -> canvasEnabled;
      case AUDIO -> audioEnabled;
      case FONTS -> fontsEnabled;
      case NETWORK -> networkEnabled;
      case POWER -> powerEnabled;
      default -> true;
    };
  }
}
