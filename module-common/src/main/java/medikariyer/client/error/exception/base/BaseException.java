package medikariyer.client.error.exception.base;

import lombok.Getter;
import medikariyer.client.error.ErrorCode;
import medikariyer.client.error.ErrorKind;

@Getter
public abstract class BaseException extends RuntimeException {
  private final ErrorCode errorCode;

  protected BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
  }

  // 동적 인자를 받는 생성자 (String.format 활용)
  protected BaseException(ErrorCode errorCode, Object... args) {
    super(String.format(errorCode.getMessage(), args));
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.getMessage(), cause);
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(String.format(errorCode.getMessage(), args), cause);
    this.errorCode = errorCode;
  }

  public ErrorKind getKind() {
    return errorCode.getKind();
  }

  /** 응답 상태 코드. 응답 자체가 없는 경우 하위 클래스가 재정의합니다. */
  public int getStatusCode() {
    return errorCode.getStatus().value();
  }
}
