package medikariyer.client.external;

import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import medikariyer.client.core.port.out.CredentialStore;
import medikariyer.client.core.port.out.SessionState;
import medikariyer.client.domain.model.session.AuthenticatedUser;
import medikariyer.client.domain.model.session.Session;
import medikariyer.client.error.exception.ApiException;
import medikariyer.client.external.dto.DoctorRegistrationRequest;
import medikariyer.client.external.dto.LoginRequest;
import medikariyer.client.infrastructure.http.dto.ApiEnvelope;
import medikariyer.client.infrastructure.http.dto.AuthPayload;
import medikariyer.client.infrastructure.http.dto.RefreshTokenRequest;
import medikariyer.client.infrastructure.http.dto.UserPayload;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * 모바일 인증 API 클라이언트
 *
 * <ul>
 *   <li>login: 토큰 쌍을 저장하고 세션을 인증 상태로 전환
 *   <li>registerDoctor: 승인 대기 사용자 생성, 토큰은 발급되지 않음 (관리자 승인 후 로그인)
 *   <li>logout: refresh token 폐기 요청 (실패해도 무시), 로컬 세션은 항상 정리
 *   <li>me: 파이프라인을 거쳐 현재 사용자 조회
 * </ul>
 *
 * <p>login/registerDoctor/me는 {@code RequestPipeline} 필터가 걸린 WebClient를 사용하므로 오류 응답은 분류된 예외로
 * 전달됩니다. logout은 필터가 없는 WebClient를 사용합니다. 로그아웃하려고 토큰을 갱신하는 일은 없어야 합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class AuthApiClient {

  private static final ParameterizedTypeReference<ApiEnvelope<AuthPayload>> AUTH_RESPONSE =
      new ParameterizedTypeReference<>() {};

  private final WebClient apiWebClient;
  private final WebClient plainWebClient;
  private final CredentialStore credentialStore;
  private final SessionState sessionState;

  public CompletableFuture<Session> login(String email, String password) {
    return apiWebClient
        .post()
        .uri(ApiEndpoints.LOGIN)
        .bodyValue(new LoginRequest(email, password))
        .retrieve()
        .bodyToMono(AUTH_RESPONSE)
        .map(this::startSession)
        .toFuture();
  }

  public CompletableFuture<AuthenticatedUser> registerDoctor(DoctorRegistrationRequest request) {
    return apiWebClient
        .post()
        .uri(ApiEndpoints.REGISTER_DOCTOR)
        .bodyValue(request)
        .retrieve()
        .bodyToMono(AUTH_RESPONSE)
        .map(
            envelope -> {
              AuthenticatedUser user = requireUser(envelope);
              log.info(
                  "[AuthApi] Doctor registered, awaiting approval: userId={}", user.id());
              return user;
            })
        .toFuture();
  }

  public CompletableFuture<AuthenticatedUser> me() {
    return apiWebClient
        .get()
        .uri(ApiEndpoints.ME)
        .retrieve()
        .bodyToMono(AUTH_RESPONSE)
        .map(this::requireUser)
        .toFuture();
  }

  /**
   * 로그아웃
   *
   * <p>서버 호출 결과와 관계없이 로컬 자격 증명을 지우고 비로그인 상태로 전환합니다. 반환된 Future는 예외로 완료되지 않습니다.
   */
  public CompletableFuture<Void> logout() {
    Mono<Void> revoke =
        credentialStore
            .getRefreshToken()
            .map(this::revokeRefreshToken)
            .orElseGet(Mono::empty);

    return revoke
        .onErrorResume(
            e -> {
              log.warn("[AuthApi] Logout call failed, clearing local session anyway: {}", e.toString());
              return Mono.empty();
            })
        .then(Mono.fromRunnable(this::clearSession))
        .then()
        .toFuture();
  }

  private Mono<Void> revokeRefreshToken(String refreshToken) {
    return plainWebClient
        .post()
        .uri(ApiEndpoints.LOGOUT)
        .bodyValue(new RefreshTokenRequest(refreshToken))
        .retrieve()
        .toBodilessEntity()
        .then();
  }

  private Session startSession(ApiEnvelope<AuthPayload> envelope) {
    AuthPayload payload = envelope.getData();
    if (payload == null
        || payload.resolveAccessToken() == null
        || payload.resolveRefreshToken() == null) {
      throw new ApiException(200, "Login response did not contain a token pair");
    }
    AuthenticatedUser user = requireUser(envelope);

    credentialStore.saveTokens(payload.resolveAccessToken(), payload.resolveRefreshToken());
    sessionState.markAuthenticated(user);
    log.info("[AuthApi] Logged in: userId={}, pendingApproval={}", user.id(), user.isPendingApproval());

    return new Session(
        payload.resolveAccessToken(),
        payload.resolveRefreshToken(),
        credentialStore.getExpiry().orElse(null),
        user);
  }

  private AuthenticatedUser requireUser(ApiEnvelope<AuthPayload> envelope) {
    AuthPayload payload = envelope.getData();
    UserPayload user = payload != null ? payload.getUser() : null;
    if (user == null) {
      throw new ApiException(200, "Response did not contain a user");
    }
    return user.toDomain();
  }

  private void clearSession() {
    credentialStore.clearTokens();
    sessionState.markUnauthenticated();
    log.info("[AuthApi] Logged out");
  }
}
