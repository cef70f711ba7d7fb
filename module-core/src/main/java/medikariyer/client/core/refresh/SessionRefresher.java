package medikariyer.client.core.refresh;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import medikariyer.client.core.port.out.CredentialStore;
import medikariyer.client.core.port.out.RefreshEndpoint;
import medikariyer.client.core.port.out.SessionState;
import medikariyer.client.domain.model.session.RefreshedSession;
import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.auth.RefreshFailedException;

/**
 * 토큰 갱신 1회 수행 (단일 호출, 동시성 제어는 {@link RefreshCoordinator} 담당)
 *
 * <ul>
 *   <li>성공: 새 토큰 쌍 저장, principal이 있으면 세션을 인증 상태로 표시
 *   <li>실패: 자격 증명 삭제, 세션을 미인증 상태로 표시
 * </ul>
 *
 * <p>두 토큰 중 하나라도 비어 있는 응답은 부분 성공이 아니라 실패입니다.
 *
 * <p>갱신 1회마다 {@link RefreshAttempt}를 만들고, 결과 반영(성공/실패)과 {@link #abandon}은 그 시도를 먼저
 * 확정한 쪽만 수행합니다. deadline 초과로 포기한 시도의 응답이 늦게 도착해도 세션을 되살리지 않습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionRefresher {

  private final CredentialStore credentialStore;
  private final SessionState sessionState;
  private final RefreshEndpoint refreshEndpoint;

  /** 가장 최근 갱신 시도 */
  private final AtomicReference<RefreshAttempt> currentAttempt = new AtomicReference<>();

  /**
   * 저장된 refresh token으로 갱신을 수행합니다.
   *
   * @return 성공 시 정상 완료, 실패 시 {@link RefreshFailedException}으로 예외 완료
   */
  public CompletableFuture<Void> refresh() {
    Optional<String> refreshToken = credentialStore.getRefreshToken();
    if (refreshToken.isEmpty()) {
      RefreshFailedException missing =
          new RefreshFailedException(PipelineErrorCode.REFRESH_TOKEN_MISSING);
      onFailure(missing);
      return CompletableFuture.failedFuture(missing);
    }

    RefreshAttempt attempt = new RefreshAttempt();
    currentAttempt.set(attempt);

    // 엔드포인트의 동기 예외도 Future 실패로 흘려보냄
    return CompletableFuture.completedFuture(refreshToken.get())
        .thenCompose(token -> attempt.track(refreshEndpoint.refresh(token)))
        .thenApply(this::requireTokenPair)
        .handle(
            (session, error) -> {
              if (!attempt.settle()) {
                log.info("[SessionRefresher] Late refresh result discarded (attempt abandoned)");
                throw new CompletionException(
                    new RefreshFailedException(PipelineErrorCode.REFRESH_ABANDONED));
              }
              if (error != null) {
                RefreshFailedException failure = toRefreshFailure(unwrapCause(error));
                onFailure(failure);
                throw new CompletionException(failure);
              }
              onSuccess(session);
              return null;
            });
  }

  /**
   * 진행 중인 갱신을 포기하고 세션을 정리합니다. deadline 초과 등 갱신 호출 밖에서 실패가 확정된 경우 사용합니다.
   *
   * <p>진행 중인 엔드포인트 호출은 취소하고, 이후 도착하는 응답은 버립니다. 시도가 이미 결과를 반영했다면 아무것도 하지 않습니다.
   */
  public void abandon(Throwable cause) {
    RefreshAttempt attempt = currentAttempt.get();
    if (attempt != null && !attempt.settle()) {
      log.debug("[SessionRefresher] Abandon ignored, attempt already settled");
      return;
    }
    if (attempt != null) {
      attempt.cancel();
    }
    onFailure(toRefreshFailure(cause));
  }

  private RefreshedSession requireTokenPair(RefreshedSession session) {
    if (session == null || !session.hasAccessToken()) {
      throw new RefreshFailedException(PipelineErrorCode.REFRESH_RESPONSE_MALFORMED, "accessToken");
    }
    if (!session.hasRefreshToken()) {
      throw new RefreshFailedException(
          PipelineErrorCode.REFRESH_RESPONSE_MALFORMED, "refreshToken");
    }
    return session;
  }

  private void onSuccess(RefreshedSession session) {
    credentialStore.saveTokens(session.accessToken(), session.refreshToken());
    if (session.user() != null) {
      sessionState.markAuthenticated(session.user());
    }
    log.info(
        "[SessionRefresher] Tokens refreshed: userId={}",
        session.user() != null ? session.user().id() : null);
  }

  private void onFailure(RefreshFailedException failure) {
    log.warn("[SessionRefresher] Refresh failed, clearing session: {}", failure.getMessage());
    credentialStore.clearTokens();
    sessionState.markUnauthenticated();
  }

  private RefreshFailedException toRefreshFailure(Throwable cause) {
    if (cause instanceof RefreshFailedException refreshFailed) {
      return refreshFailed;
    }
    return new RefreshFailedException(
        PipelineErrorCode.REFRESH_REJECTED, cause, cause.getClass().getSimpleName());
  }

  private Throwable unwrapCause(Throwable e) {
    return (e instanceof CompletionException ce && ce.getCause() != null) ? ce.getCause() : e;
  }

  /** 갱신 1회의 확정 여부와 진행 중인 엔드포인트 호출 */
  private static final class RefreshAttempt {

    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile CompletableFuture<RefreshedSession> call;

    CompletableFuture<RefreshedSession> track(CompletableFuture<RefreshedSession> call) {
      this.call = call;
      return call;
    }

    /** 처음 호출한 쪽만 true */
    boolean settle() {
      return settled.compareAndSet(false, true);
    }

    void cancel() {
      CompletableFuture<RefreshedSession> inFlight = call;
      if (inFlight != null) {
        inFlight.cancel(true);
      }
    }
  }
}
