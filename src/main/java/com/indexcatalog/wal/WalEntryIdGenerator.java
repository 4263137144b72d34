package com.indexcatalog.wal;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates WAL entry ids: a UTC timestamp with microsecond precision, an
 * underscore, and a random UUID.
 * <p>
 * Within one generator the timestamp strictly increases, even if the wall clock
 * stalls or steps back, so ids sort in generation order. Across generators the
 * UUID keeps ids unique when timestamps collide.
 */
public class WalEntryIdGenerator {
    private static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final AtomicLong lastMicros = new AtomicLong(Long.MIN_VALUE);

    public WalEntryIdGenerator() {
        this(Clock.systemUTC());
    }

    public WalEntryIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextId() {
        long now = ChronoUnit.MICROS.between(Instant.EPOCH, clock.instant());
        long micros = lastMicros.accumulateAndGet(now, (last, wall) -> Math.max(last + 1, wall));
        return format(micros) + "_" + UUID.randomUUID();
    }

    static String format(long epochMicros) {
        Instant instant = Instant.EPOCH.plus(epochMicros, ChronoUnit.MICROS);
        return FORMAT.format(instant);
    }
}
