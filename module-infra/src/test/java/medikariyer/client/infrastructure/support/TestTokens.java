package medikariyer.client.infrastructure.support;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/** 테스트용 JWT (서명 없음, payload만 의미 있음) */
public final class TestTokens {

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private TestTokens() {}

  public static String jwtExpiringAt(Instant exp) {
    return jwt("{\"userId\":7,\"role\":\"doctor\",\"exp\":" + exp.getEpochSecond() + "}");
  }

  public static String jwt(String payloadJson) {
    String header = encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");
    return header + "." + encode(payloadJson) + ".signature";
  }

  private static String encode(String json) {
    return ENCODER.encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }
}
