package medikariyer.client.core.refresh;

/** 갱신 시작/종료 콜백 (메트릭, 세션 정리 등) */
public interface RefreshListener {

  RefreshListener NO_OP = new RefreshListener() {};

  default void onRefreshStarted() {}

  /**
   * @param outcome {@link RefreshOutcome#REFRESHED} 또는 {@link RefreshOutcome#FAILED}
   * @param failure 실패 원인 (성공 시 null)
   */
  default void onRefreshCompleted(RefreshOutcome outcome, Throwable failure) {}
}
