package medikariyer.client.infrastructure.executor;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import medikariyer.client.error.exception.ExecutionFailedException;
import medikariyer.client.error.exception.base.BaseException;

/** 작업 중 발생한 예외를 언체크 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * 기본 변환기
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>BaseException, RuntimeException → 그대로 반환
   *   <li>InterruptedException → 인터럽트 플래그 복구 후 래핑
   *   <li>그 외 체크 예외 → {@link ExecutionFailedException}
   * </ol>
   */
  static ExceptionTranslator defaults() {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrapAsync(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      if (unwrapped instanceof RuntimeException re) {
        return re;
      }
      if (unwrapped instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      return new ExecutionFailedException(context.toTaskName(), unwrapped);
    };
  }

  private static Throwable unwrapAsync(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
