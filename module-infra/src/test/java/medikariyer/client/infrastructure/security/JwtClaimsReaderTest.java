package medikariyer.client.infrastructure.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import medikariyer.client.infrastructure.executor.DefaultLogicExecutor;
import medikariyer.client.infrastructure.support.TestTokens;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("JwtClaimsReader 테스트")
class JwtClaimsReaderTest {

  private final JwtClaimsReader reader =
      new JwtClaimsReader(new ObjectMapper(), new DefaultLogicExecutor(new SimpleMeterRegistry()));

  @Test
  @DisplayName("exp claim을 만료 시각으로 읽음")
  void readsExp() {
    Instant exp = Instant.parse("2026-03-01T10:15:30Z");

    assertThat(reader.readExpiry(TestTokens.jwtExpiringAt(exp))).contains(exp);
  }

  @Test
  @DisplayName("exp가 없으면 empty")
  void missingExp() {
    assertThat(reader.readExpiry(TestTokens.jwt("{\"userId\":7}"))).isEmpty();
  }

  @Test
  @DisplayName("exp가 숫자가 아니면 empty")
  void nonNumericExp() {
    assertThat(reader.readExpiry(TestTokens.jwt("{\"exp\":\"tomorrow\"}"))).isEmpty();
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"opaque-token", "a.!!!not-base64!!!.c", "a.bm90LWpzb24.c"})
  @DisplayName("읽을 수 없는 토큰은 예외 없이 empty")
  void unreadable(String token) {
    assertThat(reader.readExpiry(token)).isEmpty();
  }
}
