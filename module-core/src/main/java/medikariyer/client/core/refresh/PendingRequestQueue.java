package medikariyer.client.core.refresh;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 갱신 완료를 기다리는 요청들의 FIFO 큐
 *
 * <p>각 대기자는 한 번만 완료되는 {@link CompletableFuture}입니다. 새 토큰을 기다릴 뿐, 재시도된 HTTP
 * 호출을 기다리지는 않습니다.
 *
 * <p>스레드 안전하지 않습니다. {@link RefreshCoordinator}의 락 안에서만 접근합니다.
 */
public class PendingRequestQueue {

  private final Deque<CompletableFuture<RefreshOutcome>> waiters = new ArrayDeque<>();

  /**
   * 대기자 등록
   *
   * @return 갱신 결과로 완료될 대기자 Future
   */
  public CompletableFuture<RefreshOutcome> enqueue() {
    CompletableFuture<RefreshOutcome> waiter = new CompletableFuture<>();
    waiters.addLast(waiter);
    return waiter;
  }

  /**
   * 모든 대기자를 등록 순서대로 꺼내고 큐를 비웁니다.
   *
   * @return 등록 순서의 대기자 목록
   */
  public List<CompletableFuture<RefreshOutcome>> drain() {
    List<CompletableFuture<RefreshOutcome>> drained = new ArrayList<>(waiters);
    waiters.clear();
    return drained;
  }

  public int size() {
    return waiters.size();
  }

  public boolean isEmpty() {
    return waiters.isEmpty();
  }
}
