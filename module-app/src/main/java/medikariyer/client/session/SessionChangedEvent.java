package medikariyer.client.session;

import medikariyer.client.domain.model.session.AuthenticatedUser;

/**
 * 세션 상태 전이 이벤트
 *
 * <p>UNAUTHENTICATED 이벤트를 받은 화면은 로그인 화면으로 이동합니다. 이동 자체는 애플리케이션의 몫입니다.
 *
 * @param type 전이 유형
 * @param user 전이 후 principal, UNAUTHENTICATED이면 null
 */
public record SessionChangedEvent(Type type, AuthenticatedUser user) {

  public enum Type {
    AUTHENTICATED,
    UNAUTHENTICATED,
    ACCOUNT_DISABLED
  }
}
