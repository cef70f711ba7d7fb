package medikariyer.client.infrastructure.http;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import medikariyer.client.core.policy.EndpointPolicy;
import medikariyer.client.core.policy.EndpointType;
import medikariyer.client.core.policy.ProactiveRefreshPolicy;
import medikariyer.client.core.port.out.CredentialStore;
import medikariyer.client.core.port.out.SessionState;
import medikariyer.client.core.refresh.RefreshCoordinator;
import medikariyer.client.core.refresh.RefreshOutcome;
import medikariyer.client.core.retry.RetryLedger;
import medikariyer.client.error.ErrorCode;
import medikariyer.client.error.ErrorKind;
import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.auth.AuthException;
import medikariyer.client.error.exception.base.BaseException;
import medikariyer.client.infrastructure.monitoring.PipelineMetrics;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

/**
 * 인증 요청 파이프라인 (WebClient filter)
 *
 * <h4>요청 단계</h4>
 *
 * <ol>
 *   <li>공개/로그인/갱신 엔드포인트는 토큰 로직 없이 전달 (갱신 엔드포인트만 토큰이 있으면 부착)
 *   <li>access token이 lead time 안에 만료되면 갱신 시작, 갱신 중이면 완료까지 대기 (FIFO)
 *   <li>대기가 풀리면 저장소에서 토큰을 다시 읽어 부착하고 전송
 * </ol>
 *
 * <h4>응답 단계</h4>
 *
 * <ul>
 *   <li>2xx/3xx: 그대로 통과
 *   <li>401 (첫 번째): 재시도 기록 후 갱신을 기다리고 원 요청을 1회 재전송
 *   <li>401 (재시도 후) 또는 refresh token 없음: 세션 정리 후 {@link AuthException}
 *   <li>401 (로그인/회원가입): 자격 증명 오류, 갱신하지 않음
 *   <li>403, 그 외 4xx/5xx: {@link ErrorClassifier}로 분류해 전달, 갱신하지 않음
 *   <li>응답 없음: {@code NetworkException}, 갱신하지 않음
 * </ul>
 *
 * <p>재시도 여부는 호출자의 요청 객체가 아니라 {@link RetryLedger}에 correlation id 단위로 기록합니다.
 */
@Slf4j
public class RequestPipeline implements ExchangeFilterFunction {

  /** 요청 correlation id attribute. 없으면 생성합니다. */
  public static final String CORRELATION_ID_ATTRIBUTE = "medikariyer.correlation-id";

  private final CredentialStore credentialStore;
  private final SessionState sessionState;
  private final RefreshCoordinator refreshCoordinator;
  private final RetryLedger retryLedger;
  private final EndpointPolicy endpointPolicy;
  private final ProactiveRefreshPolicy proactiveRefreshPolicy;
  private final ErrorClassifier errorClassifier;
  private final PipelineMetrics metrics;
  private final Duration requestTimeout;

  @Builder
  public RequestPipeline(
      CredentialStore credentialStore,
      SessionState sessionState,
      RefreshCoordinator refreshCoordinator,
      RetryLedger retryLedger,
      EndpointPolicy endpointPolicy,
      ProactiveRefreshPolicy proactiveRefreshPolicy,
      ErrorClassifier errorClassifier,
      PipelineMetrics metrics,
      Duration requestTimeout) {
    this.credentialStore = credentialStore;
    this.sessionState = sessionState;
    this.refreshCoordinator = refreshCoordinator;
    this.retryLedger = retryLedger != null ? retryLedger : new RetryLedger();
    this.endpointPolicy = endpointPolicy;
    this.proactiveRefreshPolicy = proactiveRefreshPolicy;
    this.errorClassifier = errorClassifier;
    this.metrics = metrics;
    this.requestTimeout = requestTimeout;
  }

  /** 요청 1건의 파이프라인 상태 */
  private record Exchange(String correlationId, String path, EndpointType type) {}

  @Override
  public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
    String correlationId =
        request
            .attribute(CORRELATION_ID_ATTRIBUTE)
            .map(Object::toString)
            .orElseGet(() -> UUID.randomUUID().toString());
    String path = request.url().getPath();
    Exchange exchange = new Exchange(correlationId, path, endpointPolicy.classify(path));
    ClientRequest tagged =
        ClientRequest.from(request).attribute(CORRELATION_ID_ATTRIBUTE, correlationId).build();

    Mono<ClientResponse> flow =
        exchange.type().requiresToken()
            ? Mono.defer(() -> sendProtected(tagged, next, exchange))
            : Mono.defer(() -> sendUnprotected(tagged, next, exchange));

    return flow.doOnError(BaseException.class, this::recordError)
        .doFinally(signal -> retryLedger.release(correlationId));
  }

  // ==================== 요청 단계 ====================

  private Mono<ClientResponse> sendUnprotected(
      ClientRequest request, ExchangeFunction next, Exchange exchange) {
    ClientRequest outgoing = request;
    if (exchange.type() == EndpointType.REFRESH) {
      outgoing = withBearer(request, credentialStore.getAccessToken());
    }
    return send(outgoing, next)
        .flatMap(response -> handleUnprotectedResponse(response, exchange));
  }

  private Mono<ClientResponse> sendProtected(
      ClientRequest request, ExchangeFunction next, Exchange exchange) {
    if (!credentialStore.validateDeviceBinding()) {
      log.warn(
          "[RequestPipeline] Device binding mismatch, dropping session: id={}",
          exchange.correlationId());
      return terminate(PipelineErrorCode.DEVICE_BINDING_MISMATCH);
    }

    Optional<String> accessToken = credentialStore.getAccessToken();
    boolean hasRefreshToken = credentialStore.getRefreshToken().isPresent();
    if (accessToken.isEmpty() && !hasRefreshToken) {
      return Mono.error(new AuthException(PipelineErrorCode.NO_USABLE_TOKEN));
    }

    boolean refreshDue =
        accessToken.isEmpty() || proactiveRefreshPolicy.isRefreshDue(credentialStore.getExpiry());
    return Mono.fromFuture(refreshCoordinator.awaitRefresh(refreshDue && hasRefreshToken))
        .flatMap(outcome -> sendAuthorized(request, next, exchange));
  }

  /** 저장소에서 토큰을 다시 읽어 부착하고 전송 */
  private Mono<ClientResponse> sendAuthorized(
      ClientRequest request, ExchangeFunction next, Exchange exchange) {
    Optional<String> token = credentialStore.getAccessToken();
    log.debug(
        "[RequestPipeline] Sending: id={}, path={}, authorized={}",
        exchange.correlationId(),
        exchange.path(),
        token.isPresent());
    return send(withBearer(request, token), next)
        .flatMap(response -> handleProtectedResponse(response, request, next, exchange, token));
  }

  private Mono<ClientResponse> send(ClientRequest request, ExchangeFunction next) {
    return next.exchange(request)
        .timeout(requestTimeout)
        .onErrorMap(error -> !(error instanceof BaseException), errorClassifier::classifyTransport);
  }

  // ==================== 응답 단계 ====================

  private Mono<ClientResponse> handleUnprotectedResponse(
      ClientResponse response, Exchange exchange) {
    if (!response.statusCode().isError()) {
      return Mono.just(response);
    }
    return surface(response, exchange);
  }

  private Mono<ClientResponse> handleProtectedResponse(
      ClientResponse response,
      ClientRequest request,
      ExchangeFunction next,
      Exchange exchange,
      Optional<String> sentToken) {
    if (!response.statusCode().isError()) {
      return Mono.just(response);
    }
    if (response.statusCode().value() != HttpStatus.UNAUTHORIZED.value()) {
      return surface(response, exchange);
    }
    if (credentialStore.getRefreshToken().isEmpty()) {
      log.warn(
          "[RequestPipeline] 401 without refresh token, session expired: id={}",
          exchange.correlationId());
      return response.releaseBody().then(terminate(PipelineErrorCode.SESSION_EXPIRED));
    }
    if (!retryLedger.tryMarkRetried(exchange.correlationId())) {
      log.warn(
          "[RequestPipeline] 401 after retry, session expired: id={}, path={}",
          exchange.correlationId(),
          exchange.path());
      return response.releaseBody().then(terminate(PipelineErrorCode.SESSION_EXPIRED));
    }
    return response.releaseBody().then(Mono.defer(() -> retry(request, next, exchange, sentToken)));
  }

  /**
   * 첫 401 처리
   *
   * <p>다른 요청이 이미 토큰을 갱신했다면(저장된 토큰이 보낸 토큰과 다름) 갱신 없이 바로 재전송합니다. 그렇지 않으면 갱신을
   * 기다린 뒤 재전송합니다. 갱신이 실패해도 재전송은 1회 수행되며, 그 401이 최종 세션 만료가 됩니다.
   */
  private Mono<ClientResponse> retry(
      ClientRequest request,
      ExchangeFunction next,
      Exchange exchange,
      Optional<String> sentToken) {
    metrics.recordRetry();
    Optional<String> current = credentialStore.getAccessToken();
    if (current.isPresent() && !current.equals(sentToken)) {
      log.debug(
          "[RequestPipeline] Token already rotated, retrying without refresh: id={}",
          exchange.correlationId());
      return sendAuthorized(request, next, exchange);
    }

    log.debug("[RequestPipeline] 401 received, awaiting refresh: id={}", exchange.correlationId());
    return Mono.fromFuture(refreshCoordinator.awaitRefresh(true))
        .doOnNext(outcome -> logRetryOutcome(outcome, exchange))
        .flatMap(outcome -> sendAuthorized(request, next, exchange));
  }

  private void logRetryOutcome(RefreshOutcome outcome, Exchange exchange) {
    if (outcome == RefreshOutcome.FAILED) {
      log.debug(
          "[RequestPipeline] Refresh failed, retrying unauthenticated: id={}",
          exchange.correlationId());
    }
  }

  /** 오류 응답 본문을 읽어 분류된 예외로 전달 */
  private Mono<ClientResponse> surface(ClientResponse response, Exchange exchange) {
    int status = response.statusCode().value();
    boolean credentialsCall = exchange.type() == EndpointType.CREDENTIALS;
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .flatMap(
            body -> {
              BaseException error = errorClassifier.classify(status, body, credentialsCall);
              if (error.getKind() == ErrorKind.ACCOUNT_DISABLED) {
                log.warn(
                    "[RequestPipeline] Account disabled reported by backend: id={}",
                    exchange.correlationId());
                sessionState.markAccountDisabled();
              }
              return Mono.error(error);
            });
  }

  /** 복구 불가: 자격 증명 삭제, 세션 미인증 표시 후 세션 만료 오류 */
  private Mono<ClientResponse> terminate(ErrorCode errorCode) {
    return Mono.defer(
        () -> {
          credentialStore.clearTokens();
          sessionState.markUnauthenticated();
          metrics.recordTerminal();
          return Mono.error(new AuthException(errorCode));
        });
  }

  private ClientRequest withBearer(ClientRequest request, Optional<String> token) {
    return ClientRequest.from(request)
        .headers(
            headers -> {
              headers.remove(HttpHeaders.AUTHORIZATION);
              token.ifPresent(headers::setBearerAuth);
            })
        .build();
  }

  private void recordError(BaseException error) {
    metrics.recordError(error.getKind());
  }
}
