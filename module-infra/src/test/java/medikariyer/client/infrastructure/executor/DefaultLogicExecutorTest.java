package medikariyer.client.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import medikariyer.client.error.exception.ExecutionFailedException;
import medikariyer.client.error.exception.auth.AuthException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultLogicExecutor 테스트")
class DefaultLogicExecutorTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final LogicExecutor executor = new DefaultLogicExecutor(registry);
  private final TaskContext context = TaskContext.of("Test", "Run", "id=1");

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  @DisplayName("성공 시 결과 반환 및 timer 기록")
  void execute_success() {
    assertThat(executor.execute(() -> "ok", context)).isEqualTo("ok");
    assertThat(
            registry
                .get("logic.executor")
                .tags("component", "Test", "operation", "Run", "outcome", "success")
                .timer()
                .count())
        .isEqualTo(1);
  }

  @Test
  @DisplayName("체크 예외는 ExecutionFailedException으로 변환")
  void execute_checkedException_isTranslated() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new IOException("disk");
                    },
                    context))
        .isInstanceOf(ExecutionFailedException.class)
        .hasMessageContaining("Test:Run:id=1")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  @DisplayName("도메인 예외는 그대로 전파 (CompletionException은 unwrap)")
  void execute_domainException_passesThrough() {
    AuthException auth = new AuthException();

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new CompletionException(auth);
                    },
                    context))
        .isSameAs(auth);
  }

  @Test
  @DisplayName("Error는 변환 없이 전파")
  void execute_error_isRethrown() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new StackOverflowError();
                    },
                    context))
        .isInstanceOf(StackOverflowError.class);
  }

  @Test
  @DisplayName("executeOrDefault는 실패 시 기본값")
  void executeOrDefault_returnsDefault() {
    String result =
        executor.executeOrDefault(
            () -> {
              throw new IOException("boom");
            },
            "fallback",
            context);

    assertThat(result).isEqualTo("fallback");
    assertThat(
            registry
                .get("logic.executor")
                .tags("outcome", "failure")
                .timer()
                .count())
        .isEqualTo(1);
  }

  @Test
  @DisplayName("executeWithRecovery는 변환된 예외를 받음")
  void executeWithRecovery_receivesTranslated() {
    String result =
        executor.executeWithRecovery(
            () -> {
              throw new IOException("boom");
            },
            e -> e.getClass().getSimpleName(),
            context);

    assertThat(result).isEqualTo("ExecutionFailedException");
  }

  @Test
  @DisplayName("InterruptedException은 인터럽트 플래그를 복구")
  void interrupted_restoresFlag() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new InterruptedException();
                    },
                    context))
        .isInstanceOf(ExecutionFailedException.class);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  @DisplayName("TaskContext 이름 형식")
  void taskName() {
    assertThat(TaskContext.of("Jwt", "DecodeExpiry").toTaskName()).isEqualTo("Jwt:DecodeExpiry");
    assertThat(context.toTaskName()).isEqualTo("Test:Run:id=1");
  }
}
