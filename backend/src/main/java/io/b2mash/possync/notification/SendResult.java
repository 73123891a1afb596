package io.b2mash.possync.notification;

public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
