package medikariyer.client.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PipelineErrorCodeTest {

  @Test
  @DisplayName("에러 코드는 중복되지 않는다")
  void codesAreUnique() {
    Set<String> codes =
        Arrays.stream(PipelineErrorCode.values())
            .map(PipelineErrorCode::getCode)
            .collect(Collectors.toSet());

    assertThat(codes).hasSize(PipelineErrorCode.values().length);
  }

  @Test
  @DisplayName("네트워크 코드는 모두 NETWORK 분류")
  void networkCodesAreNetworkKind() {
    assertThat(PipelineErrorCode.NETWORK_TIMEOUT.getKind()).isEqualTo(ErrorKind.NETWORK);
    assertThat(PipelineErrorCode.NETWORK_CONNECTION_REFUSED.getKind()).isEqualTo(ErrorKind.NETWORK);
    assertThat(PipelineErrorCode.NETWORK_OFFLINE.getKind()).isEqualTo(ErrorKind.NETWORK);
    assertThat(PipelineErrorCode.NETWORK_UNAVAILABLE.getKind()).isEqualTo(ErrorKind.NETWORK);
  }

  @Test
  @DisplayName("로그인 401은 세션 만료와 다른 분류")
  void credentialsIsNotAuth() {
    assertThat(PipelineErrorCode.INVALID_CREDENTIALS.getKind()).isEqualTo(ErrorKind.CREDENTIALS);
    assertThat(PipelineErrorCode.SESSION_EXPIRED.getKind()).isEqualTo(ErrorKind.AUTH);
  }
}
