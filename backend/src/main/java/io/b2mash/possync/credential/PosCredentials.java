package io.b2mash.possync.credential;

/** Decrypted credentials handed to the POS client. Never persisted and never logged. */
public record PosCredentials(String clientId, String clientSecret, String locationGuid) {

  @Override
  public String toString() {
    return "PosCredentials[clientId="
        + clientId
        + ", clientSecret=***, locationGuid="
        + locationGuid
        + "]";
  }
}
