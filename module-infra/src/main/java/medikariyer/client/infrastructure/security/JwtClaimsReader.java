package medikariyer.client.infrastructure.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import medikariyer.client.infrastructure.executor.LogicExecutor;
import medikariyer.client.infrastructure.executor.TaskContext;

/**
 * JWT payload 읽기 (서명 검증 없음)
 *
 * <p>클라이언트는 만료 시각만 필요합니다. 서명 검증은 서버의 몫입니다. 읽을 수 없는 토큰은 만료 시각을 모르는 토큰으로 취급합니다.
 */
@RequiredArgsConstructor
public class JwtClaimsReader {

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  /**
   * @param token JWT access token
   * @return {@code exp} claim, 없거나 읽을 수 없으면 empty
   */
  public Optional<Instant> readExpiry(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    return executor.executeOrDefault(
        () -> decodeExpiry(token), Optional.empty(), TaskContext.of("Jwt", "DecodeExpiry"));
  }

  private Optional<Instant> decodeExpiry(String token) throws Exception {
    String[] parts = token.split("\\.");
    if (parts.length < 2) {
      return Optional.empty();
    }
    byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
    JsonNode exp = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8)).path("exp");
    if (!exp.isNumber()) {
      return Optional.empty();
    }
    return Optional.of(Instant.ofEpochSecond(exp.asLong()));
  }
}
