package medikariyer.client.core.refresh;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-flight 토큰 갱신 코디네이터
 *
 * <h4>핵심 기능</h4>
 *
 * <ul>
 *   <li>동시 요청 N개가 갱신을 요구해도 실제 갱신 호출은 1회만 수행 (Leader)
 *   <li>나머지 요청은 {@link PendingRequestQueue}에 등록되어 결과를 기다림 (Follower)
 *   <li>갱신이 끝나면(성공/실패 무관) 상태를 IDLE로 되돌리고 대기자를 등록 순서대로 깨움
 *   <li>갱신이 deadline 안에 끝나지 않으면 실패로 간주하고 대기자를 해제
 * </ul>
 *
 * <h4>상호 배제</h4>
 *
 * <p>IDLE 확인, REFRESHING 전환, 대기자 등록은 하나의 락 구간에서 수행됩니다. 그 사이에 다른 호출자가
 * 끼어들어 두 명이 동시에 Leader가 되는 일은 없습니다. 대기자 완료는 락 밖에서 수행합니다.
 *
 * <h4>사용 예시</h4>
 *
 * <pre>{@code
 * RefreshCoordinator coordinator = new RefreshCoordinator(
 *     sessionRefresher::refresh, refreshExecutor, Duration.ofSeconds(35), listener);
 *
 * coordinator.awaitRefresh(proactivePolicy.isRefreshDue(expiry))
 *     .thenApply(outcome -> attachToken(request));
 * }</pre>
 */
@Slf4j
public class RefreshCoordinator {

  /** 실제 갱신 작업 (세션 저장/정리 포함) */
  private final Supplier<CompletableFuture<Void>> refreshAction;

  /** 갱신 작업 실행용 Executor */
  private final Executor executor;

  /** 갱신이 끝나지 않을 때 실패로 간주하기까지의 시간 */
  private final Duration deadline;

  private final RefreshListener listener;

  private final ReentrantLock lock = new ReentrantLock();

  /** guarded by lock */
  private final PendingRequestQueue queue = new PendingRequestQueue();

  /** guarded by lock */
  private RefreshState state = RefreshState.IDLE;

  public RefreshCoordinator(
      Supplier<CompletableFuture<Void>> refreshAction,
      Executor executor,
      Duration deadline,
      RefreshListener listener) {
    this.refreshAction = Objects.requireNonNull(refreshAction, "refreshAction");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.deadline = Objects.requireNonNull(deadline, "deadline");
    this.listener = listener != null ? listener : RefreshListener.NO_OP;
  }

  /**
   * 갱신이 필요하거나 이미 진행 중이면 완료를 기다립니다.
   *
   * <ol>
   *   <li>IDLE + 갱신 불필요: 즉시 {@link RefreshOutcome#NOT_REQUIRED}
   *   <li>IDLE + 갱신 필요: REFRESHING으로 전환하고 Leader로 갱신 시작, 대기자로도 등록
   *   <li>REFRESHING: 대기자로 등록
   * </ol>
   *
   * <p>반환된 Future는 절대 예외로 완료되지 않습니다.
   *
   * @param refreshRequired 호출자가 갱신을 필요로 하는지 (만료 임박, 첫 401 등)
   * @return 갱신 결과 Future
   */
  public CompletableFuture<RefreshOutcome> awaitRefresh(boolean refreshRequired) {
    CompletableFuture<RefreshOutcome> waiter;
    boolean leader = false;

    lock.lock();
    try {
      if (state == RefreshState.IDLE && !refreshRequired) {
        return CompletableFuture.completedFuture(RefreshOutcome.NOT_REQUIRED);
      }
      if (state == RefreshState.IDLE) {
        state = RefreshState.REFRESHING;
        leader = true;
      }
      waiter = queue.enqueue();
      log.debug("[RefreshCoordinator] Waiter queued: leader={}, pending={}", leader, queue.size());
    } finally {
      lock.unlock();
    }

    if (leader) {
      startRefresh();
    }
    return waiter;
  }

  /** 현재 상태 (관측용 스냅샷) */
  public RefreshState getState() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public boolean isRefreshing() {
    return getState() == RefreshState.REFRESHING;
  }

  /** 대기 중인 요청 수 (관측용 스냅샷) */
  public int getPendingCount() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Leader 갱신 실행
   *
   * <p>refreshAction이 동기 예외를 던지거나 null을 반환해도 whenComplete에서 반드시 상태가 복구됩니다.
   */
  private void startRefresh() {
    log.info("[RefreshCoordinator] Token refresh started");
    listener.onRefreshStarted();

    CompletableFuture.supplyAsync(refreshAction, executor)
        .thenCompose(future -> future)
        .orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete(
            (ignored, error) -> {
              if (error == null) {
                complete(RefreshOutcome.REFRESHED, null);
              } else {
                complete(RefreshOutcome.FAILED, unwrapCause(error));
              }
            });
  }

  private void complete(RefreshOutcome outcome, Throwable failure) {
    List<CompletableFuture<RefreshOutcome>> released;

    lock.lock();
    try {
      state = RefreshState.IDLE;
      released = queue.drain();
    } finally {
      lock.unlock();
    }

    if (failure != null) {
      log.warn(
          "[RefreshCoordinator] Token refresh failed, releasing {} waiter(s): {}",
          released.size(),
          failure.toString());
    } else {
      log.info("[RefreshCoordinator] Token refresh succeeded, releasing {} waiter(s)", released.size());
    }

    notifyListener(outcome, failure);
    released.forEach(waiter -> waiter.complete(outcome));
  }

  private void notifyListener(RefreshOutcome outcome, Throwable failure) {
    try {
      listener.onRefreshCompleted(outcome, failure);
    } catch (RuntimeException e) {
      // 리스너 오류로 대기자가 영원히 남으면 안 됨
      log.error("[RefreshCoordinator] Refresh listener failed", e);
    }
  }

  private Throwable unwrapCause(Throwable e) {
    return (e instanceof CompletionException ce && ce.getCause() != null) ? ce.getCause() : e;
  }
}
