package medikariyer.client.core.policy;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("EndpointPolicy 테스트")
class EndpointPolicyTest {

  private final EndpointPolicy policy =
      new EndpointPolicy(
          "/auth/refresh",
          List.of(
              "/auth/login",
              "/auth/registerDoctor",
              "/auth/refresh",
              "/auth/forgot-password",
              "/auth/reset-password",
              "/lookup/",
              "/upload/register-photo"),
          List.of("/auth/login", "/auth/register"));

  @ParameterizedTest(name = "{0} → {1}")
  @CsvSource({
    "/auth/refresh, REFRESH",
    "/api/mobile/auth/refresh, REFRESH",
    "/auth/login, CREDENTIALS",
    "/auth/registerDoctor, CREDENTIALS",
    "/auth/forgot-password, PUBLIC",
    "/lookup/specialties, PUBLIC",
    "/upload/register-photo, PUBLIC",
    "/doctor/profile, PROTECTED",
    "/jobs?page=2, PROTECTED",
    "/auth/me, PROTECTED",
    "/auth/logout, PROTECTED"
  })
  @DisplayName("경로 분류")
  void classify(String path, EndpointType expected) {
    assertThat(policy.classify(path)).isEqualTo(expected);
  }

  @Test
  @DisplayName("빈 경로는 보호된 경로로 취급")
  void emptyPath_isProtected() {
    assertThat(policy.classify("")).isEqualTo(EndpointType.PROTECTED);
    assertThat(policy.classify(null)).isEqualTo(EndpointType.PROTECTED);
  }

  @Test
  @DisplayName("보호된 경로만 토큰이 필요")
  void onlyProtectedRequiresToken() {
    assertThat(EndpointType.PROTECTED.requiresToken()).isTrue();
    assertThat(EndpointType.REFRESH.requiresToken()).isFalse();
    assertThat(EndpointType.CREDENTIALS.requiresToken()).isFalse();
    assertThat(EndpointType.PUBLIC.requiresToken()).isFalse();
  }

  @Test
  @DisplayName("로그인/회원가입만 자격 증명 호출")
  void credentialsCall() {
    assertThat(policy.classify("/auth/login")).isEqualTo(EndpointType.CREDENTIALS);
    assertThat(policy.classify("/auth/registerDoctor")).isEqualTo(EndpointType.CREDENTIALS);
    assertThat(policy.classify("/doctor/profile")).isNotEqualTo(EndpointType.CREDENTIALS);
  }
}
