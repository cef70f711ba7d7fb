package medikariyer.client.support;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/** 서명 없는 테스트용 JWT */
public final class TestTokens {

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private TestTokens() {}

  public static String jwtExpiringAt(Instant exp, String subject) {
    String header = ENCODER.encodeToString("{\"alg\":\"HS256\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));
    String payload =
        ENCODER.encodeToString(
            ("{\"sub\":\"" + subject + "\",\"exp\":" + exp.getEpochSecond() + "}")
                .getBytes(StandardCharsets.UTF_8));
    return header + "." + payload + ".c2lnbmF0dXJl";
  }
}
