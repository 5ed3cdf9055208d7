package com.codeheadsystems.vigil.model.device;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Raw environment signals collected for a device. Every component is optional: a null value
 * means the probe was unsupported, disabled or failed.
 *
 * @param userAgent    the client identity string
 * @param screen       display geometry
 * @param timezone     timezone and offset
 * @param languages    preferred locales, in order
 * @param platform     platform string
 * @param hardware     hardware concurrency and memory hints
 * @param renderEngine rendering-engine vendor and renderer
 * @param canvasDigest digest of a canvas drawing, or an error sentinel
 * @param audioDigest  digest of an audio-processing probe, or an error sentinel
 * @param fonts        detected fonts
 * @param plugins      detected plugins or extensions
 * @param connection   network-type hints
 * @param battery      power-source hints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceSignals(
    @JsonProperty("userAgent") String userAgent,
    @JsonProperty("screen") ScreenInfo screen,
    @JsonProperty("timezone") TimezoneInfo timezone,
    @JsonProperty("languages") List<String> languages,
    @JsonProperty("platform") String platform,
    @JsonProperty("hardware") HardwareInfo hardware,
    @JsonProperty("renderEngine") RenderEngineInfo renderEngine,
    @JsonProperty("canvasDigest") String canvasDigest,
    @JsonProperty("audioDigest") String audioDigest,
    @JsonProperty("fonts") List<String> fonts,
    @JsonProperty("plugins") List<String> plugins,
    @JsonProperty("connection") ConnectionInfo connection,
    @JsonProperty("battery") BatteryInfo battery) {

  public DeviceSignals {
    languages = languages == null ? null : List.copyOf(languages);
    fonts = fonts == null ? null : List.copyOf(fonts);
    plugins = plugins == null ? null : List.copyOf(plugins);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .userAgent(userAgent).screen(screen).timezone(timezone).languages(languages)
        .platform(platform).hardware(hardware).renderEngine(renderEngine)
        .canvasDigest(canvasDigest).audioDigest(audioDigest).fonts(fonts).plugins(plugins)
        .connection(connection).battery(battery);
  }

  /**
   * Display geometry.
   *
   * @param width      width in pixels
   * @param height     height in pixels
   * @param colorDepth color depth in bits
   * @param pixelRatio device pixel ratio
   */
  public record ScreenInfo(@JsonProperty("width") int width,
                           @JsonProperty("height") int height,
                           @JsonProperty("colorDepth") int colorDepth,
                           @JsonProperty("pixelRatio") double pixelRatio) {
  }

  /**
   * Timezone.
   *
   * @param zoneId        IANA zone id, e.g. {@code America/Sao_Paulo}
   * @param offsetMinutes offset from UTC in minutes
   */
  public record TimezoneInfo(@JsonProperty("zoneId") String zoneId,
                             @JsonProperty("offsetMinutes") int offsetMinutes) {
  }

  /**
   * Hardware hints.
   *
   * @param concurrency    logical processor count
   * @param deviceMemoryGb reported memory in GB, 0 when the platform does not report it
   * @param maxTouchPoints maximum simultaneous touch points
   */
  public record HardwareInfo(@JsonProperty("concurrency") int concurrency,
                             @JsonProperty("deviceMemoryGb") double deviceMemoryGb,
                             @JsonProperty("maxTouchPoints") int maxTouchPoints) {
  }

  /**
   * Rendering engine probe.
   *
   * @param vendor   vendor string
   * @param renderer renderer string
   */
  public record RenderEngineInfo(@JsonProperty("vendor") String vendor,
                                 @JsonProperty("renderer") String renderer) {
  }

  /**
   * Network-type hints.
   *
   * @param effectiveType e.g. {@code 4g}
   * @param downlinkMbps  estimated downlink
   * @param rttMs         estimated round-trip time
   */
  public record ConnectionInfo(@JsonProperty("effectiveType") String effectiveType,
                               @JsonProperty("downlinkMbps") double downlinkMbps,
                               @JsonProperty("rttMs") int rttMs) {
  }

  /**
   * Power-source hints.
   *
   * @param charging whether the device is charging
   * @param level    charge level in [0,1]
   */
  public record BatteryInfo(@JsonProperty("charging") boolean charging,
                            @JsonProperty("level") double level) {
  }

  /**
   * Builder for {@link DeviceSignals}; unset components stay absent.
   */
  public static final class Builder {
    private String userAgent;
    private ScreenInfo screen;
    private TimezoneInfo timezone;
    private List<String> languages;
    private String platform;
    private HardwareInfo hardware;
    private RenderEngineInfo renderEngine;
    private String canvasDigest;
    private String audioDigest;
    private List<String> fonts;
    private List<String> plugins;
    private ConnectionInfo connection;
    private BatteryInfo battery;

    private Builder() {
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public Builder screen(ScreenInfo screen) {
      this.screen = screen;
      return this;
    }

    public Builder timezone(TimezoneInfo timezone) {
      this.timezone = timezone;
      return this;
    }

    public Builder languages(List<String> languages) {
      this.languages = languages;
      return this;
    }

    public Builder platform(String platform) {
      this.platform = platform;
      return this;
    }

    public Builder hardware(HardwareInfo hardware) {
      this.hardware = hardware;
      return this;
    }

    public Builder renderEngine(RenderEngineInfo renderEngine) {
      this.renderEngine = renderEngine;
      return this;
    }

    public Builder canvasDigest(String canvasDigest) {
      this.canvasDigest = canvasDigest;
      return this;
    }

    public Builder audioDigest(String audioDigest) {
      this.audioDigest = audioDigest;
      return this;
    }

    public Builder fonts(List<String> fonts) {
      this.fonts = fonts;
      return this;
    }

    public Builder plugins(List<String> plugins) {
      this.plugins = plugins;
      return this;
    }

    public Builder connection(ConnectionInfo connection) {
      this.connection = connection;
      return this;
    }

    public Builder battery(BatteryInfo battery) {
      this.battery = battery;
      return this;
    }

    public DeviceSignals build() {
      return new DeviceSignals(userAgent, screen, timezone, languages, platform, hardware,
          renderEngine, canvasDigest, audioDigest, fonts, plugins, connection, battery);
    }
  }
}
