package medikariyer.client.domain.model.session;

/**
 * 인증된 사용자 (세션 principal)
 *
 * <p>모바일 API가 로그인/토큰 갱신 응답으로 돌려주는 최소 사용자 정보입니다.
 *
 * @param id 사용자 ID
 * @param email 이메일
 * @param role 역할 (doctor, hospital, admin)
 * @param firstName 이름 (프로필이 없으면 null)
 * @param lastName 성 (프로필이 없으면 null)
 * @param active 계정 활성 여부
 * @param approved 관리자 승인 여부
 */
public record AuthenticatedUser(
    Long id,
    String email,
    String role,
    String firstName,
    String lastName,
    boolean active,
    boolean approved) {

  /** 승인 대기 중인 사용자인지 (로그인은 가능하지만 대기 화면으로 보내야 함) */
  public boolean isPendingApproval() {
    return active && !approved;
  }

  /** 비활성화 처리된 사본 */
  public AuthenticatedUser deactivated() {
    return new AuthenticatedUser(id, email, role, firstName, lastName, false, approved);
  }
}
