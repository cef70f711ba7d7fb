package medikariyer.client.external.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * {@code POST /auth/registerDoctor} 요청 본문
 *
 * <p>title: Dr., Uz. Dr., Dr. Öğr. Üyesi, Doç. Dr., Prof. Dr. 중 하나. 검증은 서버가 하며 실패하면 422와 필드별
 * 메시지가 돌아옵니다.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DoctorRegistrationRequest(
    String email,
    String password,
    @JsonProperty("first_name") String firstName,
    @JsonProperty("last_name") String lastName,
    String title,
    @JsonProperty("specialty_id") Long specialtyId,
    @JsonProperty("subspecialty_id") Long subspecialtyId,
    @JsonProperty("profile_photo") String profilePhoto) {

  @Override
  public String toString() {
    return "DoctorRegistrationRequest[email=" + email + ", title=" + title + "]";
  }
}
