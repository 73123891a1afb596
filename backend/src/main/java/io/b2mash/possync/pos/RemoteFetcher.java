package io.b2mash.possync.pos;

import io.b2mash.possync.credential.PosCredentials;
import io.b2mash.possync.syncjob.SyncWindow;

/** Client of a POS provider's order history API. */
public interface RemoteFetcher {

  /**
   * Returns an access token for the credentials. May be served from a cache.
   *
   * @throws UpstreamAuthException on any non-2xx answer
   */
  String authenticate(PosCredentials credentials);

  /** Authenticates against the provider without consulting any token cache. */
  void verifyCredentials(PosCredentials credentials);

  /**
   * Fetches one page of orders inside the window. Transient failures are retried with backoff
   * before surfacing as {@link TransientNetworkException}.
   */
  PosPage fetchPage(String accessToken, String locationGuid, SyncWindow window, PageCursor cursor);
}
