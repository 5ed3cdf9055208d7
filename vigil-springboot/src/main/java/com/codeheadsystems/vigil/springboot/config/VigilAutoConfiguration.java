package com.codeheadsystems.vigil.springboot.config;

import com.codeheadsystems.vigil.device.fingerprint.DeviceFingerprintGenerator;
import com.codeheadsystems.vigil.device.fingerprint.FingerprintConfig;
import com.codeheadsystems.vigil.device.risk.RiskScorer;
import com.codeheadsystems.vigil.device.risk.RiskThresholds;
import com.codeheadsystems.vigil.model.auth.AuthIdentity;
import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.auth.AuthSession;
import com.codeheadsystems.vigil.server.config.AuthConfig;
import com.codeheadsystems.vigil.server.config.FallbackChain;
import com.codeheadsystems.vigil.server.crypto.Argon2PinHasher;
import com.codeheadsystems.vigil.server.crypto.PinHasher;
import com.codeheadsystems.vigil.server.crypto.RandomProvider;
import com.codeheadsystems.vigil.server.event.SecurityEventSink;
import com.codeheadsystems.vigil.server.event.Slf4jSecurityEventSink;
import com.codeheadsystems.vigil.server.fraud.DeviceRiskFraudAssessor;
import com.codeheadsystems.vigil.server.fraud.FraudSignalAssessor;
import com.codeheadsystems.vigil.server.manager.AuthOrchestrator;
import com.codeheadsystems.vigil.server.manager.RateLimitBucket;
import com.codeheadsystems.vigil.server.manager.RateLimiter;
import com.codeheadsystems.vigil.server.manager.SessionManager;
import com.codeheadsystems.vigil.server.store.InMemoryKeyValueStore;
import com.codeheadsystems.vigil.server.store.InMemorySessionStore;
import com.codeheadsystems.vigil.server.store.KeyValueStore;
import com.codeheadsystems.vigil.server.store.SessionStore;
import com.codeheadsystems.vigil.server.verifier.CredentialVerifier;
import com.codeheadsystems.vigil.server.verifier.OneTimeCode;
import com.codeheadsystems.vigil.server.verifier.OneTimeCodeSender;
import com.codeheadsystems.vigil.server.verifier.PinCredential;
import com.codeheadsystems.vigil.server.verifier.PinVerifier;
import com.codeheadsystems.vigil.server.verifier.PlatformAuthenticator;
import com.codeheadsystems.vigil.server.verifier.PlatformCredential;
import com.codeheadsystems.vigil.server.verifier.PlatformVerifier;
import com.codeheadsystems.vigil.server.verifier.PushChallenge;
import com.codeheadsystems.vigil.server.verifier.PushDispatcher;
import com.codeheadsystems.vigil.server.verifier.PushVerifier;
import com.codeheadsystems.vigil.server.verifier.SmsVerifier;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the authentication engine. Every bean backs off when the application defines its own;
 * the key-value stores back off by bean name.
 * <p>
 * The platform, SMS and push verifiers are only registered when the application provides a
 * {@link PlatformAuthenticator}, {@link OneTimeCodeSender} or {@link PushDispatcher}. Methods in
 * the fallback chain without a verifier fail over to the next method.
 */
@AutoConfiguration
@EnableConfigurationProperties(VigilProperties.class)
public class VigilAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(VigilAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock vigilClock() {
    return Clock.systemUTC();
  }

  /**
   * Default {@link SecureRandom} instance. Override this bean to supply a custom implementation:
   * <pre>{@code
   *   @Bean
   *   public SecureRandom secureRandom() {
   *     return SecureRandom.getInstance("NativePRNG");
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public RandomProvider randomProvider(SecureRandom secureRandom) {
    return new RandomProvider(secureRandom);
  }

  // ── Configuration records ─────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public AuthConfig authConfig(VigilProperties props) {
    return validated("vigil", () -> new AuthConfig(
        props.getPlatformTimeout(),
        props.getMaxPinAttempts(),
        props.getPinLockoutDuration(),
        props.getSessionTtl(),
        props.getOtpExpiry(),
        props.getMaxOtpAttempts(),
        props.getOtpLength(),
        props.getRateLimitWindow(),
        props.getMaxRateLimitAttempts(),
        props.getPushChallengeTtl(),
        new FallbackChain(props.getFallbackChain() == null ? List.of() : props.getFallbackChain()),
        props.isBlockOnHighDeviceRisk()));
  }

  @Bean
  @ConditionalOnMissingBean
  public FingerprintConfig fingerprintConfig(VigilProperties props) {
    VigilProperties.Fingerprint fp = props.getFingerprint();
    if (FingerprintConfig.DEFAULT.salt().equals(fp.getSalt())) {
      log.warn("Using the default fingerprint salt. Set vigil.fingerprint.salt per deployment.");
    }
    return validated("vigil.fingerprint", () -> new FingerprintConfig(fp.getSalt(),
        fp.isRenderEngineEnabled(), fp.isCanvasEnabled(), fp.isAudioEnabled(), fp.isFontsEnabled(),
        fp.isNetworkEnabled(), fp.isPowerEnabled(), fp.isCacheEnabled()));
  }

  @Bean
  @ConditionalOnMissingBean
  public RiskThresholds riskThresholds(VigilProperties props) {
    return validated("vigil.risk", () -> new RiskThresholds(props.getRisk().getMediumThreshold(),
        props.getRisk().getHighThreshold()));
  }

  @Bean
  @ConditionalOnMissingBean
  public PinHasher pinHasher(VigilProperties props) {
    return validated("vigil.argon2", () -> new Argon2PinHasher(props.getArgon2MemoryKib(),
        props.getArgon2Iterations(), props.getArgon2Parallelism()));
  }

  // ── Stores ────────────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public SessionStore sessionStore(Clock clock) {
    log.warn("Using in-memory session store. All data will be lost on restart. Do not use in production.");
    return new InMemorySessionStore(clock);
  }

  @Bean
  @ConditionalOnMissingBean(name = "vigilSessionIndex")
  public KeyValueStore<String, AuthSession> vigilSessionIndex() {
    return new InMemoryKeyValueStore<>();
  }

  @Bean
  @ConditionalOnMissingBean(name = "vigilRateLimitStore")
  public KeyValueStore<AuthIdentity, RateLimitBucket> vigilRateLimitStore() {
    log.warn("Using in-memory rate limit store. Limits are per process. Do not use in production.");
    return new InMemoryKeyValueStore<>();
  }

  @Bean
  @ConditionalOnMissingBean(name = "vigilPinCredentialStore")
  public KeyValueStore<AuthIdentity, PinCredential> vigilPinCredentialStore() {
    log.warn("Using in-memory PIN credential store. All data will be lost on restart. Do not use in production.");
    return new InMemoryKeyValueStore<>();
  }

  @Bean
  @ConditionalOnMissingBean(name = "vigilPlatformCredentialStore")
  public KeyValueStore<AuthIdentity, PlatformCredential> vigilPlatformCredentialStore() {
    log.warn("Using in-memory platform credential store. All data will be lost on restart. Do not use in production.");
    return new InMemoryKeyValueStore<>();
  }

  @Bean
  @ConditionalOnMissingBean(name = "vigilOneTimeCodeStore")
  public KeyValueStore<AuthIdentity, OneTimeCode> vigilOneTimeCodeStore() {
    return new InMemoryKeyValueStore<>();
  }

  @Bean
  @ConditionalOnMissingBean(name = "vigilPushChallengeStore")
  public KeyValueStore<String, PushChallenge> vigilPushChallengeStore() {
    return new InMemoryKeyValueStore<>();
  }

  // ── Engine ────────────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public DeviceFingerprintGenerator deviceFingerprintGenerator(FingerprintConfig config, Clock clock) {
    return new DeviceFingerprintGenerator(config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RiskScorer riskScorer(RiskThresholds thresholds) {
    return new RiskScorer(thresholds);
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimiter rateLimiter(KeyValueStore<AuthIdentity, RateLimitBucket> vigilRateLimitStore,
                                 AuthConfig config, Clock clock) {
    return new RateLimiter(vigilRateLimitStore, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionManager sessionManager(KeyValueStore<String, AuthSession> vigilSessionIndex,
                                       SessionStore sessionStore, RandomProvider randomProvider,
                                       AuthConfig config, Clock clock) {
    return new SessionManager(vigilSessionIndex, sessionStore, randomProvider, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public SecurityEventSink securityEventSink() {
    return new Slf4jSecurityEventSink();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "vigil.risk", name = "fraud-block-level")
  public FraudSignalAssessor fraudSignalAssessor(RiskScorer riskScorer, VigilProperties props) {
    return new DeviceRiskFraudAssessor(riskScorer, props.getRisk().getFraudBlockLevel());
  }

  // ── Verifiers ─────────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public PinVerifier pinVerifier(KeyValueStore<AuthIdentity, PinCredential> vigilPinCredentialStore,
                                 PinHasher pinHasher, RandomProvider randomProvider,
                                 AuthConfig config, Clock clock) {
    return new PinVerifier(vigilPinCredentialStore, pinHasher, randomProvider, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(PlatformAuthenticator.class)
  public PlatformVerifier platformVerifier(PlatformAuthenticator authenticator,
                                           KeyValueStore<AuthIdentity, PlatformCredential> vigilPlatformCredentialStore,
                                           RandomProvider randomProvider, AuthConfig config,
                                           Clock clock) {
    return new PlatformVerifier(authenticator, vigilPlatformCredentialStore, randomProvider, config,
        clock);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(OneTimeCodeSender.class)
  public SmsVerifier smsVerifier(KeyValueStore<AuthIdentity, OneTimeCode> vigilOneTimeCodeStore,
                                 OneTimeCodeSender sender, RandomProvider randomProvider,
                                 AuthConfig config, Clock clock) {
    return new SmsVerifier(vigilOneTimeCodeStore, sender, randomProvider, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(PushDispatcher.class)
  public PushVerifier pushVerifier(KeyValueStore<String, PushChallenge> vigilPushChallengeStore,
                                   PushDispatcher dispatcher, RandomProvider randomProvider,
                                   AuthConfig config, Clock clock) {
    return new PushVerifier(vigilPushChallengeStore, dispatcher, randomProvider, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public AuthOrchestrator authOrchestrator(AuthConfig config, RateLimiter rateLimiter,
                                           SessionManager sessionManager,
                                           ObjectProvider<CredentialVerifier> verifiers,
                                           DeviceFingerprintGenerator fingerprintGenerator,
                                           RiskScorer riskScorer, SecurityEventSink eventSink,
                                           ObjectProvider<FraudSignalAssessor> fraudAssessor,
                                           Clock clock) {
    List<CredentialVerifier> available = verifiers.orderedStream().toList();
    for (AuthMethod method : config.fallbackChain().methods()) {
      if (available.stream().noneMatch(v -> v.method() == method)) {
        log.warn("No verifier for {} in the fallback chain; attempts will fall through to the next method",
            method.wireName());
      }
    }
    return new AuthOrchestrator(config, rateLimiter, sessionManager, available,
        fingerprintGenerator, riskScorer, eventSink, fraudAssessor.getIfAvailable(), clock);
  }

  private static <T> T validated(String prefix, Supplier<T> factory) {
    try {
      return factory.get();
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalStateException("Invalid " + prefix + ".* configuration: " + e.getMessage(), e);
    }
  }
}
