package com.reliefx.orchestrator.pipeline;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * Generates request ids: UUIDs in the version-7 layout, a 48-bit Unix
 * millisecond timestamp followed by 74 random bits.
 *
 * Ids sort roughly by submission time and are collision-free in practice
 * across any number of router instances.
 */
@Component
public class RequestIdGenerator {

    private final SecureRandom random = new SecureRandom();

    public String next() {
        return next(System.currentTimeMillis()).toString();
    }

    UUID next(long epochMillis) {
        long msb = ((epochMillis & 0xFFFF_FFFF_FFFFL) << 16)
                | 0x7000L                          // version 7
                | (random.nextInt() & 0x0FFFL);    // rand_a
        long lsb = (random.nextLong() & 0x3FFF_FFFF_FFFF_FFFFL)
                | 0x8000_0000_0000_0000L;          // IETF variant
        return new UUID(msb, lsb);
    }
}
