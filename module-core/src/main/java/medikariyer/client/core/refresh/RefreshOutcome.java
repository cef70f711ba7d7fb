package medikariyer.client.core.refresh;

/**
 * 대기 중인 요청에 전달되는 갱신 결과
 *
 * <p>대기자는 항상 정상 완료(normal completion)로 결과를 받습니다. 갱신 실패도 {@link #FAILED}로
 * 전달되며 예외로 전파되지 않습니다.
 */
public enum RefreshOutcome {
  /** 새 토큰이 저장됨 */
  REFRESHED,
  /** 갱신 실패. 대기자는 기존 토큰으로 진행하고 401 경로에 맡김 */
  FAILED,
  /** 갱신이 필요 없었음 (IDLE 상태에서 갱신 요구 없음) */
  NOT_REQUIRED;

  public boolean isRefreshed() {
    return this == REFRESHED;
  }
}
