package medikariyer.client.infrastructure.http;

import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import medikariyer.client.core.refresh.RefreshListener;
import medikariyer.client.core.refresh.RefreshOutcome;
import medikariyer.client.core.refresh.SessionRefresher;
import medikariyer.client.infrastructure.monitoring.PipelineMetrics;

/**
 * 갱신 종료 시 메트릭을 기록하고, deadline 초과로 끝난 갱신은 세션을 정리합니다.
 *
 * <p>갱신 호출 자체가 실패한 경우 {@link SessionRefresher}가 이미 세션을 정리했으므로 여기서는 deadline 초과만
 * 처리합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class PipelineRefreshListener implements RefreshListener {

  private final PipelineMetrics metrics;
  private final SessionRefresher sessionRefresher;

  @Override
  public void onRefreshCompleted(RefreshOutcome outcome, Throwable failure) {
    metrics.recordRefresh(outcome);
    if (failure instanceof TimeoutException) {
      log.warn("[RequestPipeline] Refresh exceeded its deadline, abandoning session");
      sessionRefresher.abandon(failure);
    }
  }
}
