package com.codeheadsystems.vigil.device.signal;

import com.codeheadsystems.vigil.model.device.DeviceSignals.BatteryInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.ConnectionInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.HardwareInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.RenderEngineInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.ScreenInfo;
import com.codeheadsystems.vigil.model.device.DeviceSignals.TimezoneInfo;
import java.util.List;
import java.util.Optional;

/**
 * Capability interface over the runtime environment of the device being fingerprinted.
 * <p>
 * One method per signal category. An empty result means the probe is unsupported on this
 * device. Implementations may also throw a {@link RuntimeException} from any probe; the
 * fingerprint generator records that category as absent and continues.
 */
public interface SignalProvider {

  Optional<String> userAgent();

  Optional<ScreenInfo> screen();

  Optional<TimezoneInfo> timezone();

  Optional<List<String>> languages();

  Optional<String> platform();

  Optional<HardwareInfo> hardware();

  Optional<RenderEngineInfo> renderEngine();

  Optional<String> canvasDigest();

  Optional<String> audioDigest();

  Optional<List<String>> fonts();

  Optional<List<String>> plugins();

  Optional<ConnectionInfo> connection();

  Optional<BatteryInfo> battery();
}
