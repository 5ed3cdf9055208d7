package com.codeheadsystems.vigil.device.signal;

import com.codeheadsystems.vigil.model.device.DeviceSignals;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * The fingerprint signal categories in their fixed order.
 * <p>
 * Weights are in hundredths. Only categories with a non-zero weight take part in confidence
 * scoring, comparison and the fingerprint id; network and power hints are kept as raw signals
 * only because they change between calls on the same device.
 */
public enum SignalCategory {
  USER_AGENT(15, DeviceSignals::userAgent,
      s -> s.userAgent() != null && !"unknown".equals(s.userAgent()) && s.userAgent().length() > 10),
  SCREEN(10, DeviceSignals::screen,
      s -> s.screen() != null && s.screen().width() > 0),
  TIMEZONE(10, DeviceSignals::timezone,
      s -> s.timezone() != null && s.timezone().zoneId() != null
          && !s.timezone().zoneId().isBlank() && !"unknown".equals(s.timezone().zoneId())),
  LANGUAGES(5, DeviceSignals::languages,
      s -> s.languages() != null && !s.languages().isEmpty()),
  PLATFORM(5, DeviceSignals::platform,
      s -> s.platform() != null && !s.platform().isBlank() && !"unknown".equals(s.platform())),
  HARDWARE(10, DeviceSignals::hardware,
      s -> s.hardware() != null && s.hardware().concurrency() > 0),
  RENDER_ENGINE(15, DeviceSignals::renderEngine,
      s -> s.renderEngine() != null
          && known(s.renderEngine().vendor()) && known(s.renderEngine().renderer())),
  CANVAS(15, DeviceSignals::canvasDigest,
      s -> notSentinel(s.canvasDigest(), "canvas-not-supported", "canvas-error")),
  AUDIO(10, DeviceSignals::audioDigest,
      s -> notSentinel(s.audioDigest(), "audio-not-supported", "audio-error")),
  FONTS(10, DeviceSignals::fonts,
      s -> s.fonts() != null && !s.fonts().isEmpty()),
  PLUGINS(5, DeviceSignals::plugins,
      s -> s.plugins() != null && !s.plugins().isEmpty()),
  NETWORK(0, DeviceSignals::connection, s -> s.connection() != null),
  POWER(0, DeviceSignals::battery, s -> s.battery() != null);

  /**
   * Sum of all category weights, in hundredths.
   */
  public static final int TOTAL_WEIGHT = 110;

  private final int weight;
  private final Function<DeviceSignals, Object> extractor;
  private final Predicate<DeviceSignals> meaningful;

  SignalCategory(int weight, Function<DeviceSignals, Object> extractor,
                 Predicate<DeviceSignals> meaningful) {
    this.weight = weight;
    this.extractor = extractor;
    this.meaningful = meaningful;
  }

  public int weight() {
    return weight;
  }

  /**
   * Whether this category contributes to scoring and to the fingerprint id.
   *
   * @return true for the stable categories
   */
  public boolean isStable() {
    return weight > 0;
  }

  public Object valueOf(DeviceSignals signals) {
    return extractor.apply(signals);
  }

  /**
   * Whether the collected value is present and not an error sentinel or placeholder.
   *
   * @param signals the signals
   * @return true if the category counts toward confidence
   */
  public boolean isMeaningful(DeviceSignals signals) {
    return meaningful.test(signals);
  }

  /**
   * Stable textual rendering used in the fingerprint id, null when absent.
   *
   * @param signals the signals
   * @return the rendered value or null
   */
  public String render(DeviceSignals signals) {
    Object value = valueOf(signals);
    if (value == null) {
      return null;
    }
    return switch (this) {
      case SCREEN -> {
        DeviceSignals.ScreenInfo s = signals.screen();
        yield s.width() + "x" + s.height() + "x" + s.colorDepth() + "@" + s.pixelRatio();
      }
      case TIMEZONE -> signals.timezone().zoneId() + "/" + signals.timezone().offsetMinutes();
      case HARDWARE -> {
        DeviceSignals.HardwareInfo h = signals.hardware();
        yield h.concurrency() + "," + h.deviceMemoryGb() + "," + h.maxTouchPoints();
      }
      case RENDER_ENGINE -> signals.renderEngine().vendor() + "~" + signals.renderEngine().renderer();
      case LANGUAGES, FONTS, PLUGINS -> String.join(",", toStrings((List<?>) value));
      default -> String.valueOf(value);
    };
  }

  private static List<String> toStrings(List<?> values) {
    return values.stream().map(String::valueOf).toList();
  }

  private static boolean known(String value) {
    return value != null && !value.isBlank() && !"unknown".equals(value);
  }

  private static boolean notSentinel(String value, String... sentinels) {
    if (value == null || value.isBlank()) {
      return false;
    }
    for (String sentinel : sentinels) {
      if (sentinel.equals(value)) {
        return false;
      }
    }
    return true;
  }
}
