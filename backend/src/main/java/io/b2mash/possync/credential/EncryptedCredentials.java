package io.b2mash.possync.credential;

/**
 * Credential fields as stored on the restaurant row. {@code clientId} and {@code
 * encryptedClientSecret} are vault ciphertexts; {@code locationId} is the plain location GUID.
 * Any field may be null when the POS connection is incomplete.
 */
public record EncryptedCredentials(
    String clientId, String encryptedClientSecret, String locationId) {}
