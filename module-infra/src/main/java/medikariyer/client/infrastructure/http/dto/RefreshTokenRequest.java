package medikariyer.client.infrastructure.http.dto;

/** {@code POST /auth/refresh}, {@code POST /auth/logout} 요청 본문 */
public record RefreshTokenRequest(String refreshToken) {

  @Override
  public String toString() {
    return "RefreshTokenRequest[***]";
  }
}
