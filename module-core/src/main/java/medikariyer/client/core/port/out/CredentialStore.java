package medikariyer.client.core.port.out;

import java.time.Instant;
import java.util.Optional;

/**
 * Port for durable token storage.
 *
 * <p>Shared mutable state: only a successful refresh, a failed refresh, login and logout write it.
 * Every other caller must re-read instead of assuming a value is unchanged between read and use.
 */
public interface CredentialStore {

  Optional<String> getAccessToken();

  Optional<String> getRefreshToken();

  /**
   * Expiry of the current access token.
   *
   * @return empty when there is no token or its expiry cannot be determined
   */
  Optional<Instant> getExpiry();

  void saveTokens(String accessToken, String refreshToken);

  void clearTokens();

  /**
   * Check that stored credentials were issued on this device.
   *
   * @return true if the binding holds (or no binding was ever recorded)
   */
  boolean validateDeviceBinding();
}
