package com.codeheadsystems.vigil.device.signal;

import com.codeheadsystems.vigil.model.device.DeviceSignals;
import com.codeheadsystems.vigil.model.device.DeviceSignals.BatteryInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.ConnectionInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.HardwareInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.RenderEngineInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.ScreenInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.TimezoneInfo;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SignalProvider} over signals that were collected elsewhere, typically by a client and
 * submitted with the authentication request.
 */
public class ReportedSignalProvider implements SignalProvider {

  private final DeviceSignals signals;

  public ReportedSignalProvider(DeviceSignals signals) {
    this.signals = Objects.requireNonNull(signals, "signals");
  }

  @Override
  public Optional<String> userAgent() {
    return Optional.ofNullable(signals.userAgent());
  }

  @Override
  public Optional<ScreenInfo> screen() {
    return Optional.ofNullable(signals.screen());
  }

  @Override
  public Optional<TimezoneInfo> timezone() {
    return Optional.ofNullable(signals.timezone());
  }

  @Override
  public Optional<List<String>> languages() {
    return Optional.ofNullable(signals.languages());
  }

  @Override
  public Optional<String> platform() {
    return Optional.ofNullable(signals.platform());
  }

  @Override
  public Optional<HardwareInfo> hardware() {
    return Optional.ofNullable(signals.hardware());
  }

  @Override
  public Optional<RenderEngineInfo> renderEngine() {
    return Optional.ofNullable(signals.renderEngine());
  }

  @Override
  public Optional<String> canvasDigest() {
    return Optional.ofNullable(signals.canvasDigest());
  }

  @Override
  public Optional<String> audioDigest() {
    return Optional.ofNullable(signals.audioDigest());
  }

  @Override
  public Optional<List<String>> fonts() {
    return Optional.ofNullable(signals.fonts());
  }

  @Override
  public Optional<List<String>> plugins() {
    return Optional.ofNullable(signals.plugins());
  }

  @Override
  public Optional<ConnectionInfo> connection() {
    return Optional.ofNullable(signals.connection());
  }

  @Override
  public Optional<BatteryInfo> battery() {
    return Optional.ofNullable(signals.battery());
  }
}
