package medikariyer.client.core.retry;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 401 재시도 기록
 *
 * <p>호출자가 넘긴 요청 객체를 변경하는 대신, 파이프라인이 요청 correlation id 단위로 재시도 여부를
 * 기록합니다. 한 요청은 401 때문에 최대 한 번만 재시도됩니다.
 */
public class RetryLedger {

  private final Set<String> retried = ConcurrentHashMap.newKeySet();

  /**
   * 재시도 기록을 시도합니다.
   *
   * @param correlationId 요청 식별자
   * @return 처음 기록되었으면 true (재시도 허용), 이미 재시도된 요청이면 false
   */
  public boolean tryMarkRetried(String correlationId) {
    return retried.add(correlationId);
  }

  /** 요청이 끝나면 기록을 제거합니다. */
  public void release(String correlationId) {
    retried.remove(correlationId);
  }

  public int size() {
    return retried.size();
  }
}
