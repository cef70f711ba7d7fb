package medikariyer.client.error.exception.base;

import medikariyer.client.error.ErrorCode;

/**
 * ClientBaseException: 서버가 응답을 돌려주었지만 요청이 거절된 경우의 예외. 사용자에게 구체적인 실패 원인을 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "%s" 형태의 메시지 템플릿에 백엔드 메시지를 채워 넣을 때 사용
  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
