package medikariyer.client.infrastructure.http.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 로그인/토큰 갱신 응답의 {@code data}
 *
 * <p>갱신 응답은 토큰이 최상위에, 로그인 응답은 {@code tokens} 객체 안에 있습니다. 두 형태 모두 받아들입니다.
 *
 * <pre>
 * refresh: {"accessToken": "...", "refreshToken": "...", "user": {...}}
 * login:   {"tokens": {"accessToken": "...", "refreshToken": "..."}, "user": {...}, "profile": {...}}
 * </pre>
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthPayload {

  @JsonAlias("token")
  private String accessToken;

  @JsonAlias("refresh_token")
  private String refreshToken;

  private TokenPair tokens;

  private UserPayload user;

  public String resolveAccessToken() {
    if (accessToken != null) {
      return accessToken;
    }
    return tokens != null ? tokens.getAccessToken() : null;
  }

  public String resolveRefreshToken() {
    if (refreshToken != null) {
      return refreshToken;
    }
    return tokens != null ? tokens.getRefreshToken() : null;
  }
}
