package medikariyer.client.infrastructure.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import medikariyer.client.infrastructure.executor.LogicExecutor;
import medikariyer.client.infrastructure.executor.TaskContext;

/**
 * HMAC-SHA256 기반 기기 fingerprint
 *
 * <p>토큰 저장 시 기기 fingerprint를 함께 기록하고, 다른 기기로 옮겨진 자격 증명은 사용하지 않습니다.
 *
 * <ul>
 *   <li>fingerprint 비교는 상수 시간 비교 사용
 *   <li>기기 식별자 원문은 저장하지 않음
 * </ul>
 */
public class DeviceFingerprintProvider {

  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private final byte[] secretBytes;
  private final String deviceId;
  private final LogicExecutor executor;

  public DeviceFingerprintProvider(String secret, String deviceId, LogicExecutor executor) {
    Objects.requireNonNull(secret, "fingerprint secret must not be null");
    Objects.requireNonNull(deviceId, "deviceId must not be null");
    this.secretBytes = secret.getBytes(StandardCharsets.UTF_8);
    this.deviceId = deviceId;
    this.executor = executor;
  }

  /** 현재 기기의 fingerprint (Base64 URL-safe) */
  public String current() {
    byte[] hash = computeHmac(deviceId);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
  }

  /** 기록된 fingerprint가 현재 기기와 일치하는지 */
  public boolean matches(String fingerprint) {
    if (fingerprint == null) {
      return false;
    }
    return MessageDigest.isEqual(
        current().getBytes(StandardCharsets.UTF_8), fingerprint.getBytes(StandardCharsets.UTF_8));
  }

  private byte[] computeHmac(String value) {
    TaskContext context = TaskContext.of("Fingerprint", "ComputeHmac", "***");

    return executor.execute(
        () -> {
          Mac mac = Mac.getInstance(HMAC_ALGORITHM);
          mac.init(new SecretKeySpec(secretBytes, HMAC_ALGORITHM));
          return mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
        },
        context);
  }
}
