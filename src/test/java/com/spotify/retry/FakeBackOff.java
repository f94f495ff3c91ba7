package com.spotify.retry;

import java.time.Duration;
import java.util.List;

/** Yields a fixed sequence of delays after every reset, then {@link BackOff#STOP}. */
public class FakeBackOff implements BackOff {
  private final List<Duration> delays;
  private int index = 0;
  public int resetCalls = 0;
  public int nextBackOffCalls = 0;

  public FakeBackOff(List<Duration> delays) {
    this.delays = delays;
  }

  public static FakeBackOff ofMillis(long... delaysMs) {
    final Duration[] delays = new Duration[delaysMs.length];
    for (int i = 0; i < delaysMs.length; i++) {
      delays[i] = Duration.ofMillis(delaysMs[i]);
    }
    return new FakeBackOff(List.of(delays));
  }

  @Override
  public void reset() {
    resetCalls++;
    index = 0;
  }

  @Override
  public Duration nextBackOff() {
    nextBackOffCalls++;
    if (index >= delays.size()) {
      return STOP;
    }
    return delays.get(index++);
  }
}
