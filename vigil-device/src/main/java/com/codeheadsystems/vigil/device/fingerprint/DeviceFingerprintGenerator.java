package com.codeheadsystems.vigil.device.fingerprint;

import com.codeheadsystems.vigil.device.signal.SignalCategory;
import com.codeheadsystems.vigil.device.signal.SignalProvider;
import com.codeheadsystems.vigil.model.device.DeviceFingerprint;
import com.codeheadsystems.vigil.model.device.DeviceSignals;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a stable device fingerprint and its confidence from environment signals.
 * <p>
 * The id is the hex SHA-256 of the stable categories rendered as {@code category=value|} in
 * the fixed {@link SignalCategory} order, followed by the configured salt. Absent categories are
 * skipped, so adding or removing a signal changes the id.
 * <p>
 * Thread-safe.
 */
@Singleton
public class DeviceFingerprintGenerator {

  private static final Logger log = LoggerFactory.getLogger(DeviceFingerprintGenerator.class);
  private static final double FUZZY_MATCH_THRESHOLD = 0.8;

  private final FingerprintConfig config;
  private final Clock clock;
  private final AtomicReference<DeviceFingerprint> cached = new AtomicReference<>();

  /**
   * Instantiates a new Device fingerprint generator.
   *
   * @param config the config
   * @param clock  the clock
   */
  @Inject
  public DeviceFingerprintGenerator(final FingerprintConfig config, final Clock clock) {
    log.info("DeviceFingerprintGenerator(cache={})", config.cacheEnabled());
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Probes the local device and returns its fingerprint. With caching enabled the first result
   * is returned until {@link #clearCache()} is called.
   *
   * @param provider the signal provider of this device
   * @return the fingerprint
   */
  public DeviceFingerprint generate(SignalProvider provider) {
    if (config.cacheEnabled()) {
      DeviceFingerprint existing = cached.get();
      if (existing != null) {
        return existing;
      }
    }
    DeviceFingerprint fingerprint = fingerprint(collect(provider));
    if (config.cacheEnabled()) {
      cached.compareAndSet(null, fingerprint);
      return cached.get();
    }
    return fingerprint;
  }

  /**
   * Computes a fingerprint for signals reported by a remote device. Never cached.
   *
   * @param signals the signals
   * @return the fingerprint
   */
  public DeviceFingerprint fingerprint(DeviceSignals signals) {
    Objects.requireNonNull(signals, "signals");
    DeviceSignals filtered = withoutDisabledProbes(signals);
    String id = deriveId(filtered);
    double confidence = confidence(filtered);
    log.debug("fingerprint(id={}, confidence={})", id.substring(0, 12), confidence);
    return new DeviceFingerprint(id, filtered, confidence, clock.instant());
  }

  public void clearCache() {
    cached.set(null);
  }

  /**
   * Collects every enabled probe. A probe that is empty or throws is recorded as absent.
   *
   * @param provider the provider
   * @return the collected signals
   */
  public DeviceSignals collect(SignalProvider provider) {
    Objects.requireNonNull(provider, "provider");
    return DeviceSignals.builder()
        .userAgent(probe(SignalCategory.USER_AGENT, provider::userAgent))
        .screen(probe(SignalCategory.SCREEN, provider::screen))
        .timezone(probe(SignalCategory.TIMEZONE, provider::timezone))
        .languages(probe(SignalCategory.LANGUAGES, provider::languages))
        .platform(probe(SignalCategory.PLATFORM, provider::platform))
        .hardware(probe(SignalCategory.HARDWARE, provider::hardware))
        .renderEngine(probe(SignalCategory.RENDER_ENGINE, provider::renderEngine))
        .canvasDigest(probe(SignalCategory.CANVAS, provider::canvasDigest))
        .audioDigest(probe(SignalCategory.AUDIO, provider::audioDigest))
        .fonts(probe(SignalCategory.FONTS, provider::fonts))
        .plugins(probe(SignalCategory.PLUGINS, provider::plugins))
        .connection(probe(SignalCategory.NETWORK, provider::connection))
        .battery(probe(SignalCategory.POWER, provider::battery))
        .build();
  }

  /**
   * Weighted share of stable categories that are present and meaningful.
   *
   * @param signals the signals
   * @return confidence in [0,1]
   */
  public double confidence(DeviceSignals signals) {
    int present = 0;
    for (SignalCategory category : SignalCategory.values()) {
      if (category.isStable() && category.isMeaningful(signals)) {
        present += category.weight();
      }
    }
    return Math.min(1.0, present / (double) SignalCategory.TOTAL_WEIGHT);
  }

  /**
   * Weighted similarity of two fingerprints. Fonts and plugins are compared by set overlap and
   * reported as different below 80% overlap; every other category must match exactly.
   *
   * @param first  the first fingerprint
   * @param second the second fingerprint
   * @return the comparison
   */
  public FingerprintComparison compare(DeviceFingerprint first, DeviceFingerprint second) {
    DeviceSignals a = first.signals();
    DeviceSignals b = second.signals();
    List<SignalCategory> differences = new ArrayList<>();
    double similarity = 0;
    for (SignalCategory category : SignalCategory.values()) {
      if (!category.isStable()) {
        continue;
      }
      double score = switch (category) {
        case FONTS -> jaccard(a.fonts(), b.fonts());
        case PLUGINS -> jaccard(a.plugins(), b.plugins());
        default -> Objects.equals(comparisonKey(category, a), comparisonKey(category, b)) ? 1.0 : 0.0;
      };
      similarity += category.weight() * score;
      if (score < FUZZY_MATCH_THRESHOLD) {
        differences.add(category);
      }
    }
    return new FingerprintComparison(similarity / SignalCategory.TOTAL_WEIGHT, differences);
  }

  private String deriveId(DeviceSignals signals) {
    StringBuilder material = new StringBuilder();
    for (SignalCategory category : SignalCategory.values()) {
      if (!category.isStable()) {
        continue;
      }
      String rendered = category.render(signals);
      if (rendered != null) {
        material.append(category.name().toLowerCase(Locale.ROOT)).append('=').append(rendered).append('|');
      }
    }
    material.append(config.salt());
    byte[] input = material.toString().getBytes(StandardCharsets.UTF_8);
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out);
  }

  private DeviceSignals withoutDisabledProbes(DeviceSignals signals) {
    DeviceSignals.Builder builder = signals.toBuilder();
    if (!config.renderEngineEnabled()) {
      builder.renderEngine(null);
    }
    if (!config.canvasEnabled()) {
      builder.canvasDigest(null);
    }
    if (!config.audioEnabled()) {
      builder.audioDigest(null);
    }
    if (!config.fontsEnabled()) {
      builder.fonts(null);
    }
    if (!config.networkEnabled()) {
      builder.connection(null);
    }
    if (!config.powerEnabled()) {
      builder.battery(null);
    }
    return builder.build();
  }

  private <T> T probe(SignalCategory category, Supplier<Optional<T>> probe) {
    if (!config.isEnabled(category)) {
      return null;
    }
    try {
      Optional<T> value = probe.get();
      return value == null ? null : value.orElse(null);
    } catch (RuntimeException e) {
      log.debug("Signal probe {} failed, recording as absent: {}", category, e.toString());
      return null;
    }
  }

  // Coarse keys: only the parts of a signal that identify the device, not incidental detail.
  private static Object comparisonKey(SignalCategory category, DeviceSignals s) {
    return switch (category) {
      case SCREEN -> s.screen() == null ? null : List.of(s.screen().width(), s.screen().height());
      case TIMEZONE -> s.timezone() == null ? null : s.timezone().offsetMinutes();
      case LANGUAGES -> s.languages() == null || s.languages().isEmpty() ? null : s.languages().get(0);
      case HARDWARE -> s.hardware() == null ? null : s.hardware().concurrency();
      default -> category.valueOf(s);
    };
  }

  private static double jaccard(List<String> first, List<String> second) {
    Set<String> a = first == null ? Set.of() : new HashSet<>(first);
    Set<String> b = second == null ? Set.of() : new HashSet<>(second);
    if (a.isEmpty() && b.isEmpty()) {
      return 1.0;
    }
    Set<String> union = new HashSet<>(a);
    union.addAll(b);
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    return intersection.size() / (double) union.size();
  }
}
