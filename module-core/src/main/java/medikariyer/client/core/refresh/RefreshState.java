package medikariyer.client.core.refresh;

/** 토큰 갱신 상태. 파이프라인 인스턴스당 하나만 존재하며 영속화하지 않습니다. */
public enum RefreshState {
  IDLE,
  REFRESHING
}
