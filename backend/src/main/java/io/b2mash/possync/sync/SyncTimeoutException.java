package io.b2mash.possync.sync;

/** The job ran out of its time budget. */
public class SyncTimeoutException extends RuntimeException {

  public SyncTimeoutException(String message) {
    super(message);
  }
}
