package io.b2mash.possync.pos;

/** The POS provider rejected the credentials or the access token. Never retried. */
public class UpstreamAuthException extends RuntimeException {

  public UpstreamAuthException(String message) {
    super(message);
  }

  public UpstreamAuthException(String message, Throwable cause) {
    super(message, cause);
  }
}
