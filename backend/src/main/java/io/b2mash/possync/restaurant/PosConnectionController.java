package io.b2mash.possync.restaurant;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/restaurants/{restaurantId}/pos-connection")
public class PosConnectionController {

  private final PosConnectionService posConnectionService;

  public PosConnectionController(PosConnectionService posConnectionService) {
    this.posConnectionService = posConnectionService;
  }

  @GetMapping
  public ResponseEntity<PosConnectionResponse> getConnection(@PathVariable UUID restaurantId) {
    return ResponseEntity.ok(
        PosConnectionResponse.from(posConnectionService.getRestaurant(restaurantId)));
  }

  @PutMapping
  public ResponseEntity<PosConnectionResponse> connect(
      @PathVariable UUID restaurantId, @Valid @RequestBody ConnectPosRequest request) {
    var restaurant =
        posConnectionService.connect(
            restaurantId, request.clientId(), request.clientSecret(), request.locationGuid());
    return ResponseEntity.ok(PosConnectionResponse.from(restaurant));
  }

  @DeleteMapping
  public ResponseEntity<Void> disconnect(@PathVariable UUID restaurantId) {
    posConnectionService.disconnect(restaurantId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record ConnectPosRequest(
      @NotBlank(message = "clientId is required") String clientId,
      @NotBlank(message = "clientSecret is required") String clientSecret,
      @NotBlank(message = "locationGuid is required") String locationGuid) {}

  public record PosConnectionResponse(
      UUID restaurantId,
      boolean connected,
      PosType posType,
      String locationId,
      boolean active,
      boolean initialSyncComplete,
      Instant lastSyncAt,
      Instant connectedAt) {

    public static PosConnectionResponse from(Restaurant restaurant) {
      return new PosConnectionResponse(
          restaurant.getId(),
          restaurant.isConnected(),
          restaurant.getPosType(),
          restaurant.getLocationId(),
          restaurant.isActive(),
          restaurant.isInitialSyncComplete(),
          restaurant.getLastSyncAt(),
          restaurant.getConnectedAt());
    }
  }
}
