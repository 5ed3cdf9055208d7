package com.codeheadsystems.vigil.server.crypto;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Argon2id {@link PinHasher}.
 *
 * @param memoryKib   memory cost in KiB
 * @param iterations  time cost
 * @param parallelism lanes
 */
public record Argon2PinHasher(int memoryKib, int iterations, int parallelism) implements PinHasher {

  public static final int HASH_LENGTH = 32;

  public static final Argon2PinHasher DEFAULT = new Argon2PinHasher(65536, 3, 1);

  public Argon2PinHasher {
    if (memoryKib < 8 * parallelism || iterations < 1 || parallelism < 1) {
      throw new IllegalArgumentException("Invalid Argon2 parameters: memory=" + memoryKib
          + " iterations=" + iterations + " parallelism=" + parallelism);
    }
  }

  /**
   * Cheap parameters for tests only.
   *
   * @return the hasher
   */
  public static Argon2PinHasher forTesting() {
    return new Argon2PinHasher(64, 1, 1);
  }

  @Override
  public byte[] hash(String pin, byte[] salt) {
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    Argon2Parameters params =
        new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
            .withVersion(Argon2Parameters.ARGON2_VERSION_13)
            .withSalt(salt)
            .withMemoryAsKB(memoryKib)
            .withIterations(iterations)
            .withParallelism(parallelism)
            .build();
    gen.init(params);
    byte[] output = new byte[HASH_LENGTH];
    gen.generateBytes(pin.getBytes(StandardCharsets.UTF_8), output, 0, output.length);
    return output;
  }
}
