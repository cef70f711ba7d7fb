package medikariyer.client.domain.model.session;

import java.time.Instant;
import java.util.Objects;

/**
 * 로그인으로 새로 만들어진 세션
 *
 * <p>토큰 쌍과 principal을 함께 보관합니다. {@code expiresAt}은 access token의 {@code exp} claim에서
 * 읽으며, 읽을 수 없으면 null 입니다.
 */
public record Session(
    String accessToken, String refreshToken, Instant expiresAt, AuthenticatedUser principal) {

  public Session {
    Objects.requireNonNull(accessToken, "accessToken");
    Objects.requireNonNull(refreshToken, "refreshToken");
  }

  public boolean hasKnownExpiry() {
    return expiresAt != null;
  }

  @Override
  public String toString() {
    return "Session[expiresAt=" + expiresAt + ", principal=" + principal + "]";
  }
}
