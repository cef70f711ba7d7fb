package medikariyer.client.infrastructure.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import medikariyer.client.infrastructure.executor.DefaultLogicExecutor;
import medikariyer.client.infrastructure.executor.LogicExecutor;
import medikariyer.client.infrastructure.support.TestTokens;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryCredentialStore 테스트")
class InMemoryCredentialStoreTest {

  private final LogicExecutor executor = new DefaultLogicExecutor(new SimpleMeterRegistry());
  private final JwtClaimsReader jwtReader = new JwtClaimsReader(new ObjectMapper(), executor);
  private final DeviceFingerprintProvider thisDevice =
      new DeviceFingerprintProvider("fingerprint-secret", "pixel-7-abc", executor);

  private final InMemoryCredentialStore store = new InMemoryCredentialStore(jwtReader, thisDevice);

  @Test
  @DisplayName("저장 전에는 모두 empty")
  void emptyInitially() {
    assertThat(store.getAccessToken()).isEmpty();
    assertThat(store.getRefreshToken()).isEmpty();
    assertThat(store.getExpiry()).isEmpty();
  }

  @Test
  @DisplayName("저장한 토큰과 access token의 exp를 반환")
  void savesTokensAndDerivesExpiry() {
    Instant exp = Instant.parse("2026-05-01T12:00:00Z");

    store.saveTokens(TestTokens.jwtExpiringAt(exp), "refresh-1");

    assertThat(store.getRefreshToken()).contains("refresh-1");
    assertThat(store.getExpiry()).contains(exp);
  }

  @Test
  @DisplayName("clearTokens 후 모두 empty")
  void clear() {
    store.saveTokens("access", "refresh");

    store.clearTokens();

    assertThat(store.getAccessToken()).isEmpty();
    assertThat(store.getRefreshToken()).isEmpty();
  }

  @Test
  @DisplayName("빈 토큰은 저장하지 않음")
  void rejectsBlankTokens() {
    assertThatThrownBy(() -> store.saveTokens(" ", "refresh"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("accessToken");
    assertThatThrownBy(() -> store.saveTokens("access", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("refreshToken");
  }

  @Nested
  @DisplayName("기기 바인딩")
  class DeviceBinding {

    @Test
    @DisplayName("같은 기기에서 저장한 토큰은 통과")
    void sameDevice() {
      store.saveTokens("access", "refresh");

      assertThat(store.validateDeviceBinding()).isTrue();
    }

    @Test
    @DisplayName("다른 기기에서 저장된 토큰은 실패")
    void otherDevice() {
      DeviceFingerprintProvider otherDevice =
          new DeviceFingerprintProvider("fingerprint-secret", "iphone-15-xyz", executor);
      store.restore("access", "refresh", otherDevice.current());

      assertThat(store.validateDeviceBinding()).isFalse();
    }

    @Test
    @DisplayName("fingerprint가 기록되지 않은 토큰은 통과 (이전 버전 호환)")
    void noFingerprint() {
      store.restore("access", "refresh", null);

      assertThat(store.validateDeviceBinding()).isTrue();
    }

    @Test
    @DisplayName("fingerprint는 같은 입력에 대해 항상 같음")
    void fingerprintIsStable() {
      assertThat(thisDevice.current()).isEqualTo(thisDevice.current());
      assertThat(thisDevice.matches(thisDevice.current())).isTrue();
      assertThat(thisDevice.matches(null)).isFalse();
    }
  }
}
