package io.b2mash.possync.restaurant;

import io.b2mash.possync.credential.EncryptedCredentials;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A tenant of the sync pipeline, together with its POS connection. */
@Entity
@Table(name = "restaurants")
public class Restaurant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "owner_email", length = 320)
  private String ownerEmail;

  @Enumerated(EnumType.STRING)
  @Column(name = "pos_type", length = 20)
  private PosType posType;

  @Column(name = "client_id", columnDefinition = "TEXT")
  private String clientId;

  @Column(name = "encrypted_client_secret", columnDefinition = "TEXT")
  private String encryptedClientSecret;

  @Column(name = "location_id", length = 100)
  private String locationId;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "initial_sync_complete", nullable = false)
  private boolean initialSyncComplete;

  @Column(name = "last_sync_at")
  private Instant lastSyncAt;

  @Column(name = "connected_at")
  private Instant connectedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Restaurant() {}

  public Restaurant(String name, String ownerEmail) {
    this.name = name;
    this.ownerEmail = ownerEmail;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Stores a verified, already encrypted credential set. */
  public void connectPos(PosType posType, EncryptedCredentials credentials, Instant now) {
    this.posType = posType;
    this.clientId = credentials.clientId();
    this.encryptedClientSecret = credentials.encryptedClientSecret();
    this.locationId = credentials.locationId();
    this.connectedAt = now;
    this.updatedAt = now;
  }

  /** Clears the credentials. The next connection starts over with a full sync. */
  public void disconnectPos(Instant now) {
    this.clientId = null;
    this.encryptedClientSecret = null;
    this.locationId = null;
    this.connectedAt = null;
    this.lastSyncAt = null;
    this.initialSyncComplete = false;
    this.updatedAt = now;
  }

  /** Advances the sync watermark. It never moves backwards. */
  public void recordSuccessfulSync(Instant syncedThrough, Instant now) {
    if (lastSyncAt == null || syncedThrough.isAfter(lastSyncAt)) {
      this.lastSyncAt = syncedThrough;
    }
    this.initialSyncComplete = true;
    this.updatedAt = now;
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public EncryptedCredentials storedCredentials() {
    return new EncryptedCredentials(clientId, encryptedClientSecret, locationId);
  }

  public boolean isConnected() {
    return clientId != null && encryptedClientSecret != null && locationId != null;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getOwnerEmail() {
    return ownerEmail;
  }

  public PosType getPosType() {
    return posType;
  }

  public String getLocationId() {
    return locationId;
  }

  public boolean isActive() {
    return active;
  }

  public boolean isInitialSyncComplete() {
    return initialSyncComplete;
  }

  public Instant getLastSyncAt() {
    return lastSyncAt;
  }

  public Instant getConnectedAt() {
    return connectedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
