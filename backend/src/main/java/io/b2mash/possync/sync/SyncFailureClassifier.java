package io.b2mash.possync.sync;

import io.b2mash.possync.credential.CredentialDecryptionException;
import io.b2mash.possync.credential.MissingCredentialFieldsException;
import io.b2mash.possync.exception.ResourceNotFoundException;
import io.b2mash.possync.pos.TransientNetworkException;
import io.b2mash.possync.pos.UpstreamAuthException;
import io.b2mash.possync.pos.UpstreamRequestException;
import io.b2mash.possync.restaurant.RestaurantInactiveException;
import io.b2mash.possync.syncjob.SyncError;
import io.b2mash.possync.syncjob.SyncErrorCode;
import java.time.Instant;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.ErrorResponseException;

/** Maps exceptions raised during a sync onto the job error taxonomy. */
@Component
public class SyncFailureClassifier {

  public SyncError classify(Throwable failure, Instant now) {
    return SyncError.of(codeOf(failure), messageOf(failure), now);
  }

  SyncErrorCode codeOf(Throwable failure) {
    if (failure instanceof MissingCredentialFieldsException
        || failure instanceof CredentialDecryptionException
        || failure instanceof ResourceNotFoundException
        || failure instanceof RestaurantInactiveException) {
      return SyncErrorCode.CONFIGURATION_ERROR;
    }
    if (failure instanceof UpstreamAuthException) {
      return SyncErrorCode.UPSTREAM_AUTH_ERROR;
    }
    if (failure instanceof UpstreamRequestException) {
      return SyncErrorCode.UPSTREAM_REQUEST_ERROR;
    }
    if (failure instanceof TransientNetworkException) {
      return SyncErrorCode.TRANSIENT_NETWORK_ERROR;
    }
    if (failure instanceof SyncTimeoutException) {
      return SyncErrorCode.TIMEOUT_ERROR;
    }
    if (failure instanceof DataAccessException) {
      return SyncErrorCode.STORAGE_ERROR;
    }
    return SyncErrorCode.INTERNAL_ERROR;
  }

  private static String messageOf(Throwable failure) {
    if (failure instanceof ErrorResponseException errorResponse
        && errorResponse.getBody().getDetail() != null) {
      return errorResponse.getBody().getDetail();
    }
    if (failure instanceof CredentialDecryptionException) {
      return "Stored POS credentials could not be decrypted: "
          + failure.getMessage()
          + ". Reconnect the POS integration.";
    }
    return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
  }
}
