package io.b2mash.possync.pos;

/** The provider refused the request itself (a non-auth 4xx). Retrying would not help. */
public class UpstreamRequestException extends RuntimeException {

  private final int statusCode;

  public UpstreamRequestException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
