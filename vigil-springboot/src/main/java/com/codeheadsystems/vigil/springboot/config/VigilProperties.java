package com.codeheadsystems.vigil.springboot.config;

import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.device.RiskLevel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from {@code vigil.*}. Defaults match {@code AuthConfig.DEFAULT},
 * {@code FingerprintConfig.DEFAULT}, {@code RiskThresholds.DEFAULT} and
 * {@code Argon2PinHasher.DEFAULT}.
 */
@ConfigurationProperties(prefix = "vigil")
public class VigilProperties {

  private Duration platformTimeout = Duration.ofSeconds(60);
  private int maxPinAttempts = 5;
  private Duration pinLockoutDuration = Duration.ofMinutes(15);
  private Duration sessionTtl = Duration.ofMinutes(30);
  private Duration otpExpiry = Duration.ofMinutes(5);
  private int maxOtpAttempts = 3;
  private int otpLength = 6;
  private Duration rateLimitWindow = Duration.ofMinutes(15);
  private int maxRateLimitAttempts = 10;
  private Duration pushChallengeTtl = Duration.ofMinutes(5);
  private List<AuthMethod> fallbackChain = new ArrayList<>(
      List.of(AuthMethod.PLATFORM, AuthMethod.PIN, AuthMethod.SMS, AuthMethod.PUSH));
  private boolean blockOnHighDeviceRisk = false;

  private int argon2MemoryKib = 65536;
  private int argon2Iterations = 3;
  private int argon2Parallelism = 1;

  private final Fingerprint fingerprint = new Fingerprint();
  private final Risk risk = new Risk();

  public Duration getPlatformTimeout() {
    return platformTimeout;
  }

  public void setPlatformTimeout(Duration platformTimeout) {
    this.platformTimeout = platformTimeout;
  }

  public int getMaxPinAttempts() {
    return maxPinAttempts;
  }

  public void setMaxPinAttempts(int maxPinAttempts) {
    this.maxPinAttempts = maxPinAttempts;
  }

  public Duration getPinLockoutDuration() {
    return pinLockoutDuration;
  }

  public void setPinLockoutDuration(Duration pinLockoutDuration) {
    this.pinLockoutDuration = pinLockoutDuration;
  }

  public Duration getSessionTtl() {
    return sessionTtl;
  }

  public void setSessionTtl(Duration sessionTtl) {
    this.sessionTtl = sessionTtl;
  }

  public Duration getOtpExpiry() {
    return otpExpiry;
  }

  public void setOtpExpiry(Duration otpExpiry) {
    this.otpExpiry = otpExpiry;
  }

  public int getMaxOtpAttempts() {
    return maxOtpAttempts;
  }

  public void setMaxOtpAttempts(int maxOtpAttempts) {
    this.maxOtpAttempts = maxOtpAttempts;
  }

  public int getOtpLength() {
    return otpLength;
  }

  public void setOtpLength(int otpLength) {
    this.otpLength = otpLength;
  }

  public Duration getRateLimitWindow() {
    return rateLimitWindow;
  }

  public void setRateLimitWindow(Duration rateLimitWindow) {
    this.rateLimitWindow = rateLimitWindow;
  }

  public int getMaxRateLimitAttempts() {
    return maxRateLimitAttempts;
  }

  public void setMaxRateLimitAttempts(int maxRateLimitAttempts) {
    this.maxRateLimitAttempts = maxRateLimitAttempts;
  }

  public Duration getPushChallengeTtl() {
    return pushChallengeTtl;
  }

  public void setPushChallengeTtl(Duration pushChallengeTtl) {
    this.pushChallengeTtl = pushChallengeTtl;
  }

  public List<AuthMethod> getFallbackChain() {
    return fallbackChain;
  }

  public void setFallbackChain(List<AuthMethod> fallbackChain) {
    this.fallbackChain = fallbackChain;
  }

  public boolean isBlockOnHighDeviceRisk() {
    return blockOnHighDeviceRisk;
  }

  public void setBlockOnHighDeviceRisk(boolean blockOnHighDeviceRisk) {
    this.blockOnHighDeviceRisk = blockOnHighDeviceRisk;
  }

  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  public Fingerprint getFingerprint() {
    return fingerprint;
  }

  public Risk getRisk() {
    return risk;
  }

  /**
   * {@code vigil.fingerprint.*}.
   */
  public static class Fingerprint {

    private String salt = "vigil-fingerprint-salt";
    private boolean renderEngineEnabled = true;
    private boolean canvasEnabled = true;
    private boolean audioEnabled = true;
    private boolean fontsEnabled = true;
    private boolean networkEnabled = true;
    private boolean powerEnabled = true;
    private boolean cacheEnabled = true;

    public String getSalt() {
      return salt;
    }

    public void setSalt(String salt) {
      this.salt = salt;
    }

    public boolean isRenderEngineEnabled() {
      return renderEngineEnabled;
    }

    public void setRenderEngineEnabled(boolean renderEngineEnabled) {
      this.renderEngineEnabled = renderEngineEnabled;
    }

    public boolean isCanvasEnabled() {
      return canvasEnabled;
    }

    public void setCanvasEnabled(boolean canvasEnabled) {
      this.canvasEnabled = canvasEnabled;
    }

    public boolean isAudioEnabled() {
      return audioEnabled;
    }

    public void setAudioEnabled(boolean audioEnabled) {
      this.audioEnabled = audioEnabled;
    }

    public boolean isFontsEnabled() {
      return fontsEnabled;
    }

    public void setFontsEnabled(boolean fontsEnabled) {
      this.fontsEnabled = fontsEnabled;
    }

    public boolean isNetworkEnabled() {
      return networkEnabled;
    }

    public void setNetworkEnabled(boolean networkEnabled) {
      this.networkEnabled = networkEnabled;
    }

    public boolean isPowerEnabled() {
      return powerEnabled;
    }

    public void setPowerEnabled(boolean powerEnabled) {
      this.powerEnabled = powerEnabled;
    }

    public boolean isCacheEnabled() {
      return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
      this.cacheEnabled = cacheEnabled;
    }
  }

  /**
   * {@code vigil.risk.*}.
   */
  public static class Risk {

    private double mediumThreshold = 0.3;
    private double highThreshold = 0.6;
    /**
     * When set, a {@code DeviceRiskFraudAssessor} blocking at this level is registered.
     */
    private RiskLevel fraudBlockLevel;

    public double getMediumThreshold() {
      return mediumThreshold;
    }

    public void setMediumThreshold(double mediumThreshold) {
      this.mediumThreshold = mediumThreshold;
    }

    public double getHighThreshold() {
      return highThreshold;
    }

    public void setHighThreshold(double highThreshold) {
      this.highThreshold = highThreshold;
    }

    public RiskLevel getFraudBlockLevel() {
      return fraudBlockLevel;
    }

    public void setFraudBlockLevel(RiskLevel fraudBlockLevel) {
      this.fraudBlockLevel = fraudBlockLevel;
    }
  }
}
