package medikariyer.client.error;

/**
 * 호출자에게 노출되는 에러 분류
 *
 * <p>UI는 이 값으로 분기합니다.
 *
 * <ul>
 *   <li>{@link #AUTH}: 로그아웃/로그인 화면으로 이동
 *   <li>{@link #FORBIDDEN}, {@link #API}, {@link #CREDENTIALS}: 인라인 표시, 세션 유지
 *   <li>{@link #ACCOUNT_DISABLED}: 계정 비활성 화면
 *   <li>{@link #NETWORK}: "다시 시도" UI
 * </ul>
 */
public enum ErrorKind {
  NETWORK,
  AUTH,
  FORBIDDEN,
  ACCOUNT_DISABLED,
  API,
  CREDENTIALS
}
