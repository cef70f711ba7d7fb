package medikariyer.client.domain.model.session;

/**
 * 토큰 갱신 응답 ({@code accessToken}, {@code refreshToken}, {@code user})
 *
 * <p>두 토큰 모두 비어 있지 않아야 유효한 응답입니다. 검증은 {@code SessionRefresher}가 담당합니다.
 */
public record RefreshedSession(String accessToken, String refreshToken, AuthenticatedUser user) {

  public boolean hasAccessToken() {
    return accessToken != null && !accessToken.isBlank();
  }

  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isBlank();
  }

  @Override
  public String toString() {
    return "RefreshedSession[user=" + user + "]";
  }
}
