package medikariyer.client.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * MediKariyer 모바일 API 클라이언트 설정 프로퍼티
 *
 * <p>application.yml에서 다음과 같이 설정:
 *
 * <pre>
 * medikariyer:
 *   api:
 *     base-url: https://api.medikariyer.com/api/mobile
 *     connect-timeout: 5s
 *     request-timeout: 30s
 *     refresh-deadline: 35s
 *     proactive-refresh-lead-time: 5m
 *     fingerprint-secret: ${DEVICE_FINGERPRINT_SECRET}
 * </pre>
 *
 * <h4>타임아웃 계층</h4>
 *
 * <pre>
 * ┌──────────────────────────────────────────────┐
 * │ refreshDeadline (35s): 멈춘 갱신의 상한      │
 * │  ┌────────────────────────────────────────┐  │
 * │  │ requestTimeout (30s): 요청/갱신 호출 1건 │  │
 * │  │  - connectTimeout: 5s                  │  │
 * │  └────────────────────────────────────────┘  │
 * └──────────────────────────────────────────────┘
 * </pre>
 *
 * <p>refreshDeadline은 requestTimeout보다 길어야 합니다. 그래야 정상적인 갱신 타임아웃이 deadline보다 먼저 보고됩니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "medikariyer.api")
public class ApiClientProperties {

  /** 자동 구성 활성화 여부 (기본값: true) */
  private boolean enabled = true;

  /** 모바일 API base URL */
  @NotBlank private String baseUrl = "http://localhost:3100/api/mobile";

  /**
   * TCP 연결 타임아웃
   *
   * <p>기본값: 5초
   */
  @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

  /**
   * 요청 1건의 타임아웃 (갱신 호출 포함)
   *
   * <p>기본값: 30초
   */
  @NotNull private Duration requestTimeout = Duration.ofSeconds(30);

  /**
   * 갱신 상한. 이 시간이 지나도 끝나지 않은 갱신은 실패로 보고 대기 요청을 모두 풀어줍니다.
   *
   * <p>기본값: 35초
   */
  @NotNull private Duration refreshDeadline = Duration.ofSeconds(35);

  /**
   * access token 만료 전 선제 갱신 구간
   *
   * <p>기본값: 5분
   */
  @NotNull private Duration proactiveRefreshLeadTime = Duration.ofMinutes(5);

  /** 토큰 갱신 경로 */
  @NotBlank private String refreshPath = "/auth/refresh";

  /** 토큰 없이 보내는 경로 조각 (부분 문자열 일치) */
  @NotNull
  private List<String> unauthenticatedPaths =
      new ArrayList<>(
          List.of(
              "/auth/login",
              "/auth/registerDoctor",
              "/auth/refresh",
              "/auth/forgot-password",
              "/auth/reset-password",
              "/lookup/",
              "/upload/register-photo"));

  /** 401이 세션 만료가 아니라 자격 증명 오류를 뜻하는 경로 */
  @NotNull
  private List<String> credentialPaths = new ArrayList<>(List.of("/auth/login", "/auth/register"));

  /** 기기 fingerprint에 쓰이는 기기 식별자. 비어 있으면 호스트 이름을 사용합니다. */
  private String deviceId;

  /** 기기 fingerprint HMAC 키. 설정하지 않으면 토큰을 기기에 바인딩하지 않습니다. */
  private String fingerprintSecret;
}
