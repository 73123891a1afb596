package io.b2mash.possync.notification;

/** Port for delivering sync notifications by email. */
public interface EmailProvider {

  /** Provider identifier, e.g. "smtp" or "noop". */
  String providerId();

  /** Sends the message. Delivery problems are reported in the result, not thrown. */
  SendResult sendEmail(EmailMessage message);
}
