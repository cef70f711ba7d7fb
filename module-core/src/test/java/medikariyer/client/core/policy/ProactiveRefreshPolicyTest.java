package medikariyer.client.core.policy;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProactiveRefreshPolicy 테스트")
class ProactiveRefreshPolicyTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  private final ProactiveRefreshPolicy policy =
      new ProactiveRefreshPolicy(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(5));

  @Test
  @DisplayName("만료까지 lead time보다 많이 남으면 갱신하지 않음")
  void farFromExpiry_notDue() {
    assertThat(policy.isRefreshDue(NOW.plus(Duration.ofMinutes(6)))).isFalse();
  }

  @Test
  @DisplayName("정확히 lead time 경계면 갱신")
  void exactlyAtLeadTime_isDue() {
    assertThat(policy.isRefreshDue(NOW.plus(Duration.ofMinutes(5)))).isTrue();
  }

  @Test
  @DisplayName("lead time 안이면 갱신")
  void withinLeadTime_isDue() {
    assertThat(policy.isRefreshDue(NOW.plusSeconds(30))).isTrue();
  }

  @Test
  @DisplayName("이미 만료된 토큰은 갱신")
  void alreadyExpired_isDue() {
    assertThat(policy.isRefreshDue(NOW.minusSeconds(1))).isTrue();
    assertThat(policy.isRefreshDue(NOW)).isTrue();
  }

  @Test
  @DisplayName("만료 시각을 모르면 선제 갱신하지 않음")
  void unknownExpiry_notDue() {
    assertThat(policy.isRefreshDue(Optional.empty())).isFalse();
  }
}
