package medikariyer.client.core.policy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;

/**
 * 선제 갱신 판단
 *
 * <p>access token이 lead time 안에 만료되면 요청 전에 갱신합니다. 만료 시각을 알 수 없으면 선제 갱신하지
 * 않고 401 경로에 맡깁니다.
 */
@RequiredArgsConstructor
public class ProactiveRefreshPolicy {

  private final Clock clock;
  private final Duration leadTime;

  /**
   * @param expiry access token 만료 시각
   * @return 만료까지 lead time 이하로 남았으면 true (이미 만료된 경우 포함)
   */
  public boolean isRefreshDue(Optional<Instant> expiry) {
    return expiry.map(this::isRefreshDue).orElse(false);
  }

  public boolean isRefreshDue(Instant expiry) {
    Instant threshold = clock.instant().plus(leadTime);
    return !expiry.isAfter(threshold);
  }
}
