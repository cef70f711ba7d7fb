package medikariyer.client.infrastructure.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.IntSupplier;
import lombok.RequiredArgsConstructor;
import medikariyer.client.core.refresh.RefreshOutcome;
import medikariyer.client.error.ErrorKind;

/**
 * 인증 파이프라인 메트릭
 *
 * <h3>메트릭</h3>
 *
 * <ul>
 *   <li><b>auth.refresh (Counter)</b>: 갱신 호출 결과 (tag: outcome=refreshed|failed)
 *   <li><b>auth.refresh.pending (Gauge)</b>: 갱신을 기다리는 요청 수
 *   <li><b>auth.pipeline.retry (Counter)</b>: 401 후 재시도 횟수
 *   <li><b>auth.pipeline.terminal (Counter)</b>: 세션 만료로 끝난 요청 수
 *   <li><b>auth.pipeline.error (Counter)</b>: 호출자에게 전달된 오류 (tag: kind)
 * </ul>
 *
 * <h3>Prometheus 메트릭 이름</h3>
 *
 * <pre>
 * - auth_refresh_total{outcome}
 * - auth_refresh_pending
 * - auth_pipeline_retry_total
 * - auth_pipeline_terminal_total
 * - auth_pipeline_error_total{kind}
 * </pre>
 */
@RequiredArgsConstructor
public class PipelineMetrics {

  private final MeterRegistry registry;

  /** 대기 요청 수 gauge 등록 (코디네이터 생성 후 1회) */
  public void bindPendingGauge(IntSupplier pendingCount) {
    Gauge.builder("auth.refresh.pending", pendingCount, IntSupplier::getAsInt)
        .description("Requests waiting for the in-flight token refresh")
        .strongReference(true)
        .register(registry);
  }

  public void recordRefresh(RefreshOutcome outcome) {
    Counter.builder("auth.refresh")
        .tag("outcome", outcome.name().toLowerCase())
        .register(registry)
        .increment();
  }

  public void recordRetry() {
    registry.counter("auth.pipeline.retry").increment();
  }

  public void recordTerminal() {
    registry.counter("auth.pipeline.terminal").increment();
  }

  public void recordError(ErrorKind kind) {
    Counter.builder("auth.pipeline.error")
        .tag("kind", kind.name().toLowerCase())
        .register(registry)
        .increment();
  }
}
