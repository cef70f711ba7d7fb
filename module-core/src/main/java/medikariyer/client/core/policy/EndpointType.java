package medikariyer.client.core.policy;

/** 토큰 처리 관점의 엔드포인트 분류 */
public enum EndpointType {
  /** 토큰 갱신 호출. 토큰은 있으면 붙이고, 없어도 진행 */
  REFRESH,
  /** 로그인/회원가입. 401은 자격 증명 오류 */
  CREDENTIALS,
  /** 인증 불필요 (공개 조회 등) */
  PUBLIC,
  /** 인증 필요 */
  PROTECTED;

  public boolean requiresToken() {
    return this == PROTECTED;
  }
}
