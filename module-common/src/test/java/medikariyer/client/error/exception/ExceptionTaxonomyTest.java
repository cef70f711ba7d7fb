package medikariyer.client.error.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.ConnectException;
import medikariyer.client.error.ErrorKind;
import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.auth.AuthException;
import medikariyer.client.error.exception.auth.CredentialsException;
import medikariyer.client.error.exception.auth.RefreshFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionTaxonomyTest {

  @Test
  @DisplayName("ApiException은 원래 상태 코드와 메시지를 유지한다")
  void apiExceptionKeepsStatus() {
    ApiException e = new ApiException(422, "Email is required");

    assertThat(e.getStatusCode()).isEqualTo(422);
    assertThat(e.getMessage()).isEqualTo("Email is required");
    assertThat(e.getKind()).isEqualTo(ErrorKind.API);
  }

  @Test
  @DisplayName("NetworkException은 상태 코드가 없다")
  void networkExceptionHasNoStatus() {
    NetworkException e =
        new NetworkException(PipelineErrorCode.NETWORK_CONNECTION_REFUSED, new ConnectException());

    assertThat(e.getStatusCode()).isZero();
    assertThat(e.getKind()).isEqualTo(ErrorKind.NETWORK);
    assertThat(e.getCause()).isInstanceOf(ConnectException.class);
  }

  @Test
  @DisplayName("AccountDisabledException은 ForbiddenException이지만 별도 분류")
  void accountDisabledIsForbiddenSubtype() {
    ForbiddenException e = new AccountDisabledException("Account is disabled");

    assertThat(e.getKind()).isEqualTo(ErrorKind.ACCOUNT_DISABLED);
    assertThat(e.getStatusCode()).isEqualTo(403);
  }

  @Test
  @DisplayName("기본 AuthException은 세션 만료 메시지")
  void authExceptionDefaultsToSessionExpired() {
    AuthException e = new AuthException();

    assertThat(e.getErrorCode()).isEqualTo(PipelineErrorCode.SESSION_EXPIRED);
    assertThat(e.getStatusCode()).isEqualTo(401);
  }

  @Test
  @DisplayName("메시지 템플릿에 인자가 채워진다")
  void messageTemplateIsFormatted() {
    assertThat(new CredentialsException("Wrong password").getMessage()).isEqualTo("Wrong password");
    assertThat(
            new RefreshFailedException(PipelineErrorCode.REFRESH_RESPONSE_MALFORMED, "accessToken")
                .getMessage())
        .isEqualTo("Refresh response is missing accessToken");
  }
}
