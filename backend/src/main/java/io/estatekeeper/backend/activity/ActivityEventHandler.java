package io.estatekeeper.backend.activity;

import io.estatekeeper.backend.exception.InvalidIdentifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes activity entries requested by domain services. Runs AFTER_COMMIT, ensuring:
 *
 * <ol>
 *   <li>Entries are only written for committed domain changes.
 *   <li>Failures do not affect the domain transaction.
 * </ol>
 *
 * <p>When the event is published outside a transaction it is handled immediately.
 */
@Component
public class ActivityEventHandler {

  private static final Logger log = LoggerFactory.getLogger(ActivityEventHandler.class);

  private final ActivityLog activityLog;

  public ActivityEventHandler(ActivityLog activityLog) {
    this.activityLog = activityLog;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onActivityRequested(ActivityRequestedEvent event) {
    var record = event.record();
    try {
      var result = activityLog.append(record);
      if (!result.isRecorded()) {
        log.debug(
            "Dropped activity {}/{} for estate={}",
            record.category(),
            record.action(),
            record.estateId());
      }
    } catch (InvalidIdentifierException e) {
      log.warn(
          "Rejected activity {}/{} with invalid estate id={}",
          record.category(),
          record.action(),
          record.estateId());
    }
  }
}
