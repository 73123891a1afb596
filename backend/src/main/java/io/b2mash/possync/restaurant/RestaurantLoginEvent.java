package io.b2mash.possync.restaurant;

import java.util.UUID;

/** Published by the login flow when a restaurant user signs in. */
public record RestaurantLoginEvent(UUID restaurantId, String userEmail) {}
