package io.b2mash.possync.notification;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/** Used when no SMTP host is configured. Logs instead of sending. */
@Component
@ConditionalOnExpression("'${spring.mail.host:}'.isEmpty()")
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    log.info("NoOp email: would send to {} with subject '{}'", message.to(), message.subject());
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }
}
