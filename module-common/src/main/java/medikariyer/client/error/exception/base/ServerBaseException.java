package medikariyer.client.error.exception.base;

import medikariyer.client.error.ErrorCode;

/**
 * ServerBaseException: 응답을 받지 못했거나 클라이언트 내부에서 실패한 경우의 예외. 장애 분석을 위해 원인(cause)을 보존합니다.
 */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  protected ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
