package medikariyer.client.infrastructure.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 모바일 API 공통 응답 봉투
 *
 * <pre>{@code {"success": true, "message": "Token yenilendi", "data": {...}}}</pre>
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiEnvelope<T> {

  private boolean success;

  private String message;

  private T data;
}
