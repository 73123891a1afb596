package io.b2mash.possync.pos;

/** I/O failure, timeout, 5xx or 429 from the provider. Worth retrying. */
public class TransientNetworkException extends RuntimeException {

  public TransientNetworkException(String message) {
    super(message);
  }

  public TransientNetworkException(String message, Throwable cause) {
    super(message, cause);
  }
}
