package io.b2mash.possync.credential;

import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM encryption of POS credentials at rest.
 *
 * <p>Ciphertexts are stored as {@code <ivHex>:<authTagHex>:<cipherHex>} with a random 16-byte IV
 * and a 16-byte tag. The key is the first 32 UTF-8 bytes of {@code possync.encryption-key},
 * resolved once at startup.
 */
@Component
public class CredentialVault {

  static final String CLIENT_ID = "clientId";
  static final String CLIENT_SECRET = "encryptedClientSecret";
  static final String LOCATION_ID = "locationId";

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int KEY_LENGTH = 32; // bytes
  private static final int IV_LENGTH = 16; // bytes
  private static final int TAG_LENGTH = 16; // bytes
  private static final HexFormat HEX = HexFormat.of();

  private final SecretKeySpec encryptionKey;
  private final int configuredKeyLength;
  private final SecureRandom secureRandom = new SecureRandom();

  public CredentialVault(@Value("${possync.encryption-key:}") String secret) {
    if (secret == null || secret.isBlank()) {
      this.encryptionKey = null; // Will fail at @PostConstruct
      this.configuredKeyLength = 0;
    } else {
      byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
      this.configuredKeyLength = secretBytes.length;
      this.encryptionKey =
          secretBytes.length >= KEY_LENGTH
              ? new SecretKeySpec(Arrays.copyOf(secretBytes, KEY_LENGTH), "AES")
              : null;
    }
  }

  @PostConstruct
  void validateKey() {
    if (configuredKeyLength == 0) {
      throw new IllegalStateException(
          "POSSYNC_ENCRYPTION_KEY is not set. "
              + "Cannot start without an encryption key for POS credentials.");
    }
    if (encryptionKey == null) {
      throw new IllegalStateException(
          "POSSYNC_ENCRYPTION_KEY must be at least "
              + KEY_LENGTH
              + " bytes. Got "
              + configuredKeyLength
              + " bytes.");
    }
  }

  public String encrypt(String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("plaintext must not be null");
    }
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new GCMParameterSpec(TAG_LENGTH * 8, iv));
      byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      // JCE appends the tag to the cipher text
      int bodyLength = sealed.length - TAG_LENGTH;
      byte[] body = Arrays.copyOfRange(sealed, 0, bodyLength);
      byte[] tag = Arrays.copyOfRange(sealed, bodyLength, sealed.length);
      return HEX.formatHex(iv) + ":" + HEX.formatHex(tag) + ":" + HEX.formatHex(body);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  /**
   * Reverses {@link #encrypt}.
   *
   * @throws MalformedCiphertextException if the value is not three hex segments of the expected
   *     lengths
   * @throws CiphertextAuthenticationException if the tag does not verify
   */
  public String decrypt(String ciphertext) {
    if (ciphertext == null) {
      throw new MalformedCiphertextException("Ciphertext is null");
    }
    String[] parts = ciphertext.split(":", -1);
    if (parts.length != 3) {
      throw new MalformedCiphertextException(
          "Expected 3 ciphertext segments but found " + parts.length);
    }
    byte[] iv = parseSegment(parts[0], "iv");
    byte[] tag = parseSegment(parts[1], "auth tag");
    byte[] body = parseSegment(parts[2], "cipher text");
    if (iv.length != IV_LENGTH) {
      throw new MalformedCiphertextException("IV must be " + IV_LENGTH + " bytes");
    }
    if (tag.length != TAG_LENGTH) {
      throw new MalformedCiphertextException("Auth tag must be " + TAG_LENGTH + " bytes");
    }

    byte[] sealed = new byte[body.length + tag.length];
    System.arraycopy(body, 0, sealed, 0, body.length);
    System.arraycopy(tag, 0, sealed, body.length, tag.length);
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new GCMParameterSpec(TAG_LENGTH * 8, iv));
      return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
    } catch (AEADBadTagException e) {
      throw new CiphertextAuthenticationException(e);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Decryption failed", e);
    }
  }

  /** Encrypts a freshly supplied credential set for storage. The location GUID stays plain. */
  public EncryptedCredentials encryptCredentialSet(
      String clientId, String clientSecret, String locationGuid) {
    return new EncryptedCredentials(encrypt(clientId), encrypt(clientSecret), locationGuid);
  }

  /**
   * Decrypts a stored credential set. Decryption is only attempted once all three fields are
   * present.
   *
   * @throws MissingCredentialFieldsException naming the missing and present fields
   */
  public PosCredentials decryptCredentialSet(EncryptedCredentials stored) {
    var missing = new ArrayList<String>();
    var present = new ArrayList<String>();
    classify(CLIENT_ID, stored.clientId(), missing, present);
    classify(CLIENT_SECRET, stored.encryptedClientSecret(), missing, present);
    classify(LOCATION_ID, stored.locationId(), missing, present);
    if (!missing.isEmpty()) {
      throw new MissingCredentialFieldsException(missing, present);
    }
    return new PosCredentials(
        decrypt(stored.clientId()), decrypt(stored.encryptedClientSecret()), stored.locationId());
  }

  private static void classify(
      String field, String value, ArrayList<String> missing, ArrayList<String> present) {
    if (value == null || value.isBlank()) {
      missing.add(field);
    } else {
      present.add(field);
    }
  }

  private static byte[] parseSegment(String segment, String name) {
    try {
      return HEX.parseHex(segment);
    } catch (IllegalArgumentException e) {
      throw new MalformedCiphertextException("Ciphertext " + name + " segment is not valid hex", e);
    }
  }
}
