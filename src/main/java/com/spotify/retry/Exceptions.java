package com.spotify.retry;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

public class Exceptions {

  /** Reason of a {@link CancellationSource} that was cancelled explicitly. */
  public static class Cancelled extends CancellationException {
    Cancelled(String message) {
      super(message);
    }
  }

  /** Reason of a {@link CancellationSource} whose timeout elapsed. */
  public static class DeadlineExceeded extends TimeoutException {
    DeadlineExceeded(String message) {
      super(message);
    }
  }
}
