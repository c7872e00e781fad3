package io.intellixity.entigen.identity;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;

/** UUID version 4 and version 7 generators. */
public final class UuidGenerators {
  private static final SecureRandom RANDOM = new SecureRandom();

  private UuidGenerators() {}

  public static IdentityGenerator random() {
    return UUID::randomUUID;
  }

  public static IdentityGenerator timeOrdered() {
    return timeOrdered(Clock.systemUTC());
  }

  /**
   * RFC 9562 version 7: 48-bit unix millis, version nibble, 12 random bits, variant, 62 random
   * bits.
   */
  public static IdentityGenerator timeOrdered(Clock clock) {
    return () -> {
      long millis = clock.millis();
      long msb = (millis & 0xFFFF_FFFF_FFFFL) << 16;
      msb |= 0x7000L;
      msb |= RANDOM.nextInt(1 << 12);
      long lsb = RANDOM.nextLong();
      lsb = (lsb & 0x3FFF_FFFF_FFFF_FFFFL) | 0x8000_0000_0000_0000L;
      return new UUID(msb, lsb);
    };
  }
}
