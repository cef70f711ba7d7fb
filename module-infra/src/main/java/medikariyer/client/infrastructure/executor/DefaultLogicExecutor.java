package medikariyer.client.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import medikariyer.client.common.function.ThrowingSupplier;

/**
 * Micrometer Timer 기반 LogicExecutor 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>메트릭</b>: {@code logic.executor} timer, 태그는 component/operation/outcome (dynamicValue 제외)
 * </ul>
 */
@Slf4j
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String METRIC_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;
  private final ExceptionTranslator translator;

  public DefaultLogicExecutor(MeterRegistry meterRegistry) {
    this(meterRegistry, ExceptionTranslator.defaults());
  }

  public DefaultLogicExecutor(MeterRegistry meterRegistry, ExceptionTranslator translator) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.translator = Objects.requireNonNull(translator, "translator");
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    try {
      return timed(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translator.translate(t, context);
      log.error("[LogicExecutor] Task failed: {}", context.toTaskName(), primary);
      throw primary;
    }
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeWithRecovery(
        task,
        e -> {
          log.debug(
              "[LogicExecutor] Task fell back to default: {} ({})",
              context.toTaskName(),
              e.toString());
          return defaultValue;
        },
        context);
  }

  @Override
  public <T> T executeWithRecovery(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return timed(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      return recovery.apply(translator.translate(t, context));
    }
  }

  private <T> T timed(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
    Timer.Sample sample = Timer.start(meterRegistry);
    String outcome = "success";
    try {
      return task.get();
    } catch (Throwable t) {
      outcome = "failure";
      throw t;
    } finally {
      sample.stop(
          Timer.builder(METRIC_NAME)
              .tag("component", context.component())
              .tag("operation", context.operation())
              .tag("outcome", outcome)
              .register(meterRegistry));
    }
  }
}
