package io.b2mash.possync.notification;

import io.b2mash.possync.sync.SyncFinishedEvent;
import io.b2mash.possync.syncjob.SyncJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Emails the address recorded on the job when it finishes, then flags the job so the email is
 * not sent twice. Jobs without a notification address are skipped.
 */
@Component
public class SyncNotificationListener {

  private static final Logger log = LoggerFactory.getLogger(SyncNotificationListener.class);

  private final SyncJobStore jobStore;
  private final EmailProvider emailProvider;

  public SyncNotificationListener(SyncJobStore jobStore, EmailProvider emailProvider) {
    this.jobStore = jobStore;
    this.emailProvider = emailProvider;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onSyncFinished(SyncFinishedEvent event) {
    try {
      var job = jobStore.findByJobId(event.jobId()).orElse(null);
      if (job == null) {
        log.warn("Sync job not found for notification: {}", event.jobId());
        return;
      }
      if (job.getNotificationEmail() == null || job.isNotificationSent()) {
        return;
      }

      var result = emailProvider.sendEmail(compose(job.getNotificationEmail(), event));
      if (result.success()) {
        jobStore.markNotificationSent(event.jobId());
        log.info(
            "Sent sync {} notification for job {} via {}",
            event.success() ? "success" : "failure",
            event.jobId(),
            emailProvider.providerId());
      } else {
        log.warn(
            "Sync notification for job {} was not delivered: {}",
            event.jobId(),
            result.errorMessage());
      }
    } catch (Exception e) {
      log.error("Failed to send sync notification for job {}", event.jobId(), e);
    }
  }

  static EmailMessage compose(String to, SyncFinishedEvent event) {
    if (event.success()) {
      return new EmailMessage(
          to,
          "Your POS sync is complete",
          "Imported "
              + event.ordersImported()
              + " transaction(s) in "
              + (event.durationMs() / 1000)
              + "s."
              + (event.ordersFailed() > 0
                  ? " " + event.ordersFailed() + " order(s) were incomplete and skipped."
                  : ""));
    }
    return new EmailMessage(
        to,
        "Your POS sync failed",
        "The sync could not be completed: "
            + (event.errorMessage() != null ? event.errorMessage() : "unknown error"));
  }
}
