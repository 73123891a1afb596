package io.b2mash.possync.notification;

import java.util.Objects;

/** Plain-text email to a single recipient. */
public record EmailMessage(String to, String subject, String plainTextBody) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
  }
}
