package io.b2mash.possync.restaurant;

import io.b2mash.possync.credential.CredentialVault;
import io.b2mash.possync.credential.PosCredentials;
import io.b2mash.possync.exception.ResourceNotFoundException;
import io.b2mash.possync.pos.RemoteFetcher;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Owns a restaurant's POS credentials and its sync watermark. */
@Service
public class PosConnectionService {

  private static final Logger log = LoggerFactory.getLogger(PosConnectionService.class);

  private final RestaurantRepository restaurantRepository;
  private final CredentialVault credentialVault;
  private final RemoteFetcher remoteFetcher;
  private final Clock clock;

  public PosConnectionService(
      RestaurantRepository restaurantRepository,
      CredentialVault credentialVault,
      RemoteFetcher remoteFetcher,
      Clock clock) {
    this.restaurantRepository = restaurantRepository;
    this.credentialVault = credentialVault;
    this.remoteFetcher = remoteFetcher;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public Restaurant getRestaurant(UUID restaurantId) {
    return restaurantRepository
        .findById(restaurantId)
        .orElseThrow(() -> new ResourceNotFoundException("Restaurant", restaurantId));
  }

  /**
   * Verifies the credentials with the provider, then stores them encrypted. Invalid credentials
   * are never stored. No transaction is held across the provider call.
   */
  public Restaurant connect(
      UUID restaurantId, String clientId, String clientSecret, String locationGuid) {
    var restaurant = getRestaurant(restaurantId);
    remoteFetcher.verifyCredentials(new PosCredentials(clientId, clientSecret, locationGuid));
    restaurant.connectPos(
        PosType.TOAST,
        credentialVault.encryptCredentialSet(clientId, clientSecret, locationGuid),
        clock.instant());
    log.info("Connected Toast location {} to restaurant {}", locationGuid, restaurantId);
    return restaurantRepository.save(restaurant);
  }

  @Transactional
  public Restaurant disconnect(UUID restaurantId) {
    var restaurant = getRestaurant(restaurantId);
    restaurant.disconnectPos(clock.instant());
    log.info("Disconnected POS from restaurant {}", restaurantId);
    return restaurantRepository.save(restaurant);
  }

  /**
   * Decrypts the stored credentials.
   *
   * @throws io.b2mash.possync.credential.MissingCredentialFieldsException if the connection is
   *     incomplete
   */
  @Transactional(readOnly = true)
  public PosCredentials loadCredentials(UUID restaurantId) {
    return credentialVault.decryptCredentialSet(getRestaurant(restaurantId).storedCredentials());
  }

  @Transactional
  public void recordSuccessfulSync(UUID restaurantId, Instant syncedThrough) {
    var restaurant = getRestaurant(restaurantId);
    restaurant.recordSuccessfulSync(syncedThrough, clock.instant());
    restaurantRepository.save(restaurant);
  }
}
