package io.b2mash.possync.credential;

/** A stored ciphertext could not be turned back into plaintext. */
public abstract class CredentialDecryptionException extends RuntimeException {

  protected CredentialDecryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
