package org.proxyrotor.extras;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.function.LongSupplier;
import org.proxyrotor.CorrelationIdSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates 64-bit, roughly time ordered ids: 42 bits of milliseconds since 2015-01-01, 10 bits of
 * machine id and a 12 bit per-millisecond sequence. Ids are rendered in decimal.
 */
public class SnowflakeIdSource implements CorrelationIdSource {
  private static final Logger LOG = LoggerFactory.getLogger(SnowflakeIdSource.class);

  public static final long EPOCH_MILLIS = 1420070400000L;
  private static final int MACHINE_ID_BITS = 10;
  private static final int SEQUENCE_BITS = 12;
  public static final long MAX_MACHINE_ID = (1L << MACHINE_ID_BITS) - 1;
  private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

  private final long machineId;
  private final LongSupplier clock;
  private long lastTimestamp = -1;
  private long sequence;

  /** Derives the machine id from the host name and the process id. */
  public SnowflakeIdSource() {
    this(autoMachineId());
  }

  public SnowflakeIdSource(long machineId) {
    this(machineId, System::currentTimeMillis);
  }

  SnowflakeIdSource(long machineId, LongSupplier clock) {
    if (machineId < 0 || machineId > MAX_MACHINE_ID) {
      throw new IllegalArgumentException(
          "Machine id must be between 0 and " + MAX_MACHINE_ID + ": " + machineId);
    }
    this.machineId = machineId;
    this.clock = clock;
  }

  @Override
  public String nextId() {
    return Long.toString(nextLong());
  }

  public synchronized long nextLong() {
    long now = clock.getAsLong();
    if (now < lastTimestamp) {
      // clock moved backwards: keep issuing ids from the last timestamp
      now = lastTimestamp;
    }
    if (now == lastTimestamp) {
      sequence = (sequence + 1) & MAX_SEQUENCE;
      if (sequence == 0) {
        now = waitForNextMillis(lastTimestamp);
      }
    } else {
      sequence = 0;
    }
    lastTimestamp = now;
    return ((now - EPOCH_MILLIS) << (MACHINE_ID_BITS + SEQUENCE_BITS))
        | (machineId << SEQUENCE_BITS)
        | sequence;
  }

  private long waitForNextMillis(long last) {
    long now = clock.getAsLong();
    while (now <= last) {
      Thread.onSpinWait();
      now = clock.getAsLong();
    }
    return now;
  }

  /** Splits an id into its timestamp, machine id and sequence. */
  public static long[] decompose(long id) {
    long timestamp = (id >>> (MACHINE_ID_BITS + SEQUENCE_BITS)) + EPOCH_MILLIS;
    long machine = (id >>> SEQUENCE_BITS) & MAX_MACHINE_ID;
    long seq = id & MAX_SEQUENCE;
    return new long[] {timestamp, machine, seq};
  }

  private static long autoMachineId() {
    String host;
    try {
      host = InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      LOG.debug("Could not determine host name, using pid only for machine id", e);
      host = "";
    }
    long hash = host.hashCode() * 31L + ProcessHandle.current().pid();
    return Math.floorMod(hash, MAX_MACHINE_ID + 1);
  }
}
