package medikariyer.client.external.dto;

/** {@code POST /auth/login} 요청 본문 */
public record LoginRequest(String email, String password) {

  @Override
  public String toString() {
    return "LoginRequest[email=" + email + ", password=***]";
  }
}
