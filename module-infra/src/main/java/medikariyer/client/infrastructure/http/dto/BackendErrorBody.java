package medikariyer.client.infrastructure.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 백엔드 오류 응답 본문
 *
 * <p>필드 타입이 응답마다 달라서 (문자열/배열/객체) {@link JsonNode}로 받습니다.
 *
 * <pre>{@code
 * {"success": false, "message": "Validation failed", "errors": {"email": ["required"]}}
 * {"success": false, "message": "Hesabınız pasif durumda", "code": "ACCOUNT_DISABLED"}
 * }</pre>
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendErrorBody {

  public static final BackendErrorBody EMPTY = new BackendErrorBody();

  private JsonNode message;

  private JsonNode error;

  private JsonNode errors;

  private JsonNode code;

  private JsonNode errorCode;

  /** {@code code} 또는 {@code errorCode} 중 먼저 있는 값 */
  public String resolveCode() {
    if (code != null && code.isValueNode()) {
      return code.asText();
    }
    if (errorCode != null && errorCode.isValueNode()) {
      return errorCode.asText();
    }
    return null;
  }
}
