package medikariyer.client.infrastructure.external;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import medikariyer.client.core.port.out.RefreshEndpoint;
import medikariyer.client.domain.model.session.RefreshedSession;
import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.auth.RefreshFailedException;
import medikariyer.client.infrastructure.http.dto.ApiEnvelope;
import medikariyer.client.infrastructure.http.dto.AuthPayload;
import medikariyer.client.infrastructure.http.dto.RefreshTokenRequest;
import medikariyer.client.infrastructure.http.dto.UserPayload;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@code POST /auth/refresh} 호출
 *
 * <p>파이프라인 필터가 없는 별도 WebClient를 사용합니다. 갱신 호출의 401이 다시 갱신을 부르는 재귀를 막기 위함입니다.
 *
 * <pre>
 * 요청: {"refreshToken": "..."}
 * 응답: {"success": true, "data": {"accessToken": "...", "refreshToken": "...", "user": {...}}}
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class WebClientRefreshEndpoint implements RefreshEndpoint {

  private static final ParameterizedTypeReference<ApiEnvelope<AuthPayload>> RESPONSE_TYPE =
      new ParameterizedTypeReference<>() {};

  private final WebClient refreshWebClient;
  private final String refreshPath;
  private final Duration requestTimeout;

  @Override
  public CompletableFuture<RefreshedSession> refresh(String refreshToken) {
    log.debug("[RefreshEndpoint] Refresh request: path={}", refreshPath);
    return refreshWebClient
        .post()
        .uri(refreshPath)
        .bodyValue(new RefreshTokenRequest(refreshToken))
        .retrieve()
        .bodyToMono(RESPONSE_TYPE)
        .map(this::toRefreshedSession)
        .onErrorResume(
            WebClientResponseException.class,
            ex -> {
              log.warn(
                  "[RefreshEndpoint] Refresh rejected. Status: {}", ex.getStatusCode().value());
              return Mono.error(
                  new RefreshFailedException(
                      PipelineErrorCode.REFRESH_REJECTED,
                      ex,
                      "HTTP " + ex.getStatusCode().value()));
            })
        .timeout(requestTimeout)
        .onErrorMap(
            TimeoutException.class,
            ex -> new RefreshFailedException(PipelineErrorCode.REFRESH_TIMEOUT, ex, requestTimeout))
        .toFuture();
  }

  private RefreshedSession toRefreshedSession(ApiEnvelope<AuthPayload> envelope) {
    AuthPayload payload = envelope.getData();
    if (payload == null) {
      throw new RefreshFailedException(PipelineErrorCode.REFRESH_RESPONSE_MALFORMED, "data");
    }
    UserPayload user = payload.getUser();
    return new RefreshedSession(
        payload.resolveAccessToken(),
        payload.resolveRefreshToken(),
        user != null ? user.toDomain() : null);
  }
}
