package dev.presscrawl.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.presscrawl.exception.CrawlCancelledException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RequestPacerTest {

  @Test
  void delayIsDrawnFromTheInclusiveRange() {
    RequestPacer pacer = new RequestPacer(millis -> {});

    for (int i = 0; i < 200; i++) {
      assertThat(pacer.delayMillis(Duration.ofMillis(100), Duration.ofMillis(150))).isBetween(100L, 150L);
    }
  }

  @Test
  void equalBoundsGiveAFixedDelay() {
    List<Long> sleeps = new ArrayList<>();
    RequestPacer pacer = new RequestPacer(sleeps::add);

    pacer.pause(Duration.ofMillis(250), Duration.ofMillis(250));

    assertThat(sleeps).containsExactly(250L);
  }

  @Test
  void zeroDelayDoesNotSleep() {
    List<Long> sleeps = new ArrayList<>();
    RequestPacer pacer = new RequestPacer(sleeps::add);

    pacer.pause(Duration.ZERO, Duration.ZERO);

    assertThat(sleeps).isEmpty();
  }

  @Test
  void interruptionDuringPauseCancelsAndKeepsInterruptFlag() {
    RequestPacer pacer = new RequestPacer(millis -> {
      throw new InterruptedException("stop");
    });

    try {
      assertThatThrownBy(() -> pacer.pause(Duration.ofMillis(5), Duration.ofMillis(10)))
          .isInstanceOf(CrawlCancelledException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }
}
