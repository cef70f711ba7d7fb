package medikariyer.client.infrastructure.executor;

import java.util.function.Function;
import medikariyer.client.common.function.ThrowingSupplier;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code this::method})를 활용하세요. try/catch는 이 실행기 안에만
 * 존재합니다.
 *
 * <ol>
 *   <li><b>try-catch-throw</b> (예외 변환 후 재전파) - {@link #execute}
 *   <li><b>try-catch-return</b> (기본값 반환) - {@link #executeOrDefault}
 *   <li><b>try-catch-recover</b> (복구 로직 실행) - {@link #executeWithRecovery}
 * </ol>
 *
 * <pre>{@code
 * Optional<Instant> expiry = executor.executeOrDefault(
 *     () -> decodeExpiry(token), Optional.empty(), TaskContext.of("Jwt", "DecodeExpiry"));
 * }</pre>
 */
public interface LogicExecutor {

  /**
   * 예외를 언체크 예외로 변환하여 전파
   *
   * @throws RuntimeException 변환된 예외
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 예외 발생 시 로그를 남기고 기본값 반환 */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /** 예외 발생 시 변환된 예외를 받아 복구값 생성 */
  <T> T executeWithRecovery(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);
}
