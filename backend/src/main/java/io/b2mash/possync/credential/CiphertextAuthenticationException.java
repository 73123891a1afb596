package io.b2mash.possync.credential;

/** The GCM tag did not verify: wrong key, or the IV, tag or body was altered. */
public class CiphertextAuthenticationException extends CredentialDecryptionException {

  public CiphertextAuthenticationException(Throwable cause) {
    super("Ciphertext failed authentication", cause);
  }
}
