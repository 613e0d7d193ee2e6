package org.proxyrotor.extras;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class SnowflakeIdSourceTest {

  private static final long NOW = SnowflakeIdSource.EPOCH_MILLIS + 1_000_000L;

  @Test
  void idsEncodeTimestampMachineAndSequence() {
    SnowflakeIdSource source = new SnowflakeIdSource(42, () -> NOW);

    long first = source.nextLong();
    long second = source.nextLong();

    assertThat(SnowflakeIdSource.decompose(first)).containsExactly(NOW, 42, 0);
    assertThat(SnowflakeIdSource.decompose(second)).containsExactly(NOW, 42, 1);
    assertThat(second).isGreaterThan(first);
  }

  @Test
  void sequenceRestartsOnANewMillisecond() {
    AtomicLong clock = new AtomicLong(NOW);
    SnowflakeIdSource source = new SnowflakeIdSource(1, clock::get);

    source.nextLong();
    source.nextLong();
    clock.incrementAndGet();

    assertThat(SnowflakeIdSource.decompose(source.nextLong())).containsExactly(NOW + 1, 1, 0);
  }

  @Test
  void exhaustedSequenceWaitsForTheNextMillisecond() {
    AtomicLong calls = new AtomicLong();
    // the clock ticks once every 5000 reads
    SnowflakeIdSource source = new SnowflakeIdSource(3, () -> NOW + calls.incrementAndGet() / 5000);

    Set<Long> ids = new HashSet<>();
    for (int i = 0; i < 4097; i++) {
      ids.add(source.nextLong());
    }

    assertThat(ids).hasSize(4097);
  }

  @Test
  void clockGoingBackwardsNeverRepeatsIds() {
    AtomicLong clock = new AtomicLong(NOW);
    SnowflakeIdSource source = new SnowflakeIdSource(7, clock::get);

    long before = source.nextLong();
    clock.addAndGet(-10);
    long after = source.nextLong();

    assertThat(after).isGreaterThan(before);
    assertThat(SnowflakeIdSource.decompose(after)[0]).isEqualTo(NOW);
  }

  @Test
  void machineIdIsChecked() {
    assertThatThrownBy(() -> new SnowflakeIdSource(-1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SnowflakeIdSource(SnowflakeIdSource.MAX_MACHINE_ID + 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(new SnowflakeIdSource().nextId()).matches("\\d+");
  }
}
