package medikariyer.client.core.port.out;

import java.util.concurrent.CompletableFuture;
import medikariyer.client.domain.model.session.RefreshedSession;

/**
 * Port for the token refresh call.
 *
 * <p>Implementations must not route through the request pipeline, otherwise a 401 on the refresh
 * call would recurse into another refresh.
 */
public interface RefreshEndpoint {

  /**
   * Exchange a refresh token for a new token pair.
   *
   * @param refreshToken current refresh token
   * @return the refreshed session; completes exceptionally on any failure
   */
  CompletableFuture<RefreshedSession> refresh(String refreshToken);
}
