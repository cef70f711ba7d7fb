package medikariyer.client.infrastructure.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import medikariyer.client.domain.model.session.AuthenticatedUser;

/**
 * 로그인/갱신/me 응답의 {@code user} 객체
 *
 * <p>{@code is_active}가 없으면 활성(DB 기본값 1), {@code is_approved}가 없으면 미승인(DB 기본값 0)으로 봅니다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserPayload {

  private Long id;

  private String email;

  private String role;

  @JsonProperty("first_name")
  private String firstName;

  @JsonProperty("last_name")
  private String lastName;

  @JsonProperty("is_active")
  private Boolean active;

  @JsonProperty("is_approved")
  private Boolean approved;

  public AuthenticatedUser toDomain() {
    return new AuthenticatedUser(
        id,
        email,
        role,
        firstName,
        lastName,
        active == null || active,
        approved != null && approved);
  }
}
