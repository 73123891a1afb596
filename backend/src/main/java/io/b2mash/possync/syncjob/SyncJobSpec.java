package io.b2mash.possync.syncjob;

import io.b2mash.possync.restaurant.PosType;
import java.util.UUID;

/** Everything a producer supplies to create a job. */
public record SyncJobSpec(
    UUID restaurantId,
    PosType posType,
    SyncTrigger trigger,
    SyncWindow window,
    String notificationEmail,
    int maxAttempts) {}
