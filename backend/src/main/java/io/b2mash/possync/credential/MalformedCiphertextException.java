package io.b2mash.possync.credential;

public class MalformedCiphertextException extends CredentialDecryptionException {

  public MalformedCiphertextException(String message) {
    super(message, null);
  }

  public MalformedCiphertextException(String message, Throwable cause) {
    super(message, cause);
  }
}
