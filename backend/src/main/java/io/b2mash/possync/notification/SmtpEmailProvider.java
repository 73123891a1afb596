package io.b2mash.possync.notification;

import io.b2mash.possync.config.PosSyncProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/** Sends through {@link JavaMailSender}. Only active when {@code spring.mail.host} is set. */
@Component
@ConditionalOnProperty(name = "spring.mail.host")
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private final JavaMailSender mailSender;
  private final String senderAddress;

  public SmtpEmailProvider(JavaMailSender mailSender, PosSyncProperties properties) {
    this.mailSender = mailSender;
    this.senderAddress = properties.notifications().senderAddress();
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, false, "UTF-8");
      helper.setFrom(senderAddress);
      helper.setTo(message.to());
      helper.setSubject(message.subject());
      helper.setText(message.plainTextBody() != null ? message.plainTextBody() : "", false);
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return new SendResult(true, messageId, null);
    } catch (MailException | MessagingException e) {
      log.error("Failed to send SMTP email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }
}
