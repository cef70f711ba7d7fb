package medikariyer.client.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import medikariyer.client.error.ErrorCode;
import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.AccountDisabledException;
import medikariyer.client.error.exception.ApiException;
import medikariyer.client.error.exception.ForbiddenException;
import medikariyer.client.error.exception.NetworkException;
import medikariyer.client.error.exception.auth.CredentialsException;
import medikariyer.client.error.exception.base.BaseException;
import medikariyer.client.infrastructure.executor.LogicExecutor;
import medikariyer.client.infrastructure.executor.TaskContext;
import medikariyer.client.infrastructure.http.dto.BackendErrorBody;

/**
 * 응답/전송 오류 분류기
 *
 * <p>같은 상태 코드와 본문이면 호출 순서와 무관하게 항상 같은 종류, 같은 메시지의 예외를 만듭니다. 상태를 갖지 않으며
 * 세션에 손대지 않습니다.
 *
 * <h4>메시지 우선순위</h4>
 *
 * <ol>
 *   <li>필드 검증 메시지 ({@code errors} 배열은 ", "로, 객체는 필드별 ", " 후 "; "로 연결)
 *   <li>{@code message}
 *   <li>{@code error}
 *   <li>상태 코드별 기본 메시지
 * </ol>
 */
@RequiredArgsConstructor
public class ErrorClassifier {

  public static final String ACCOUNT_DISABLED_CODE = "ACCOUNT_DISABLED";

  private static final int MAX_CAUSE_DEPTH = 10;

  private static final Map<Integer, String> STATUS_FALLBACKS =
      Map.of(
          400, "Invalid request. Please check the information you entered.",
          401, "Your session has expired. Please log in again.",
          403, "You do not have permission to perform this action.",
          404, "The requested resource was not found.",
          422, "The information you entered is invalid. Please check it.",
          500, "A server error occurred. Please try again later.",
          503, "The service is currently unavailable. Please try again later.");

  private static final String DEFAULT_FALLBACK = "An unexpected error occurred (HTTP %d).";

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  /**
   * HTTP 오류 응답 분류
   *
   * @param status 응답 상태 코드 (4xx/5xx)
   * @param body 응답 본문 (없으면 null 또는 빈 문자열)
   * @param credentialsCall 로그인/회원가입 호출 여부
   * @return 호출자에게 전달할 예외
   */
  public BaseException classify(int status, String body, boolean credentialsCall) {
    BackendErrorBody parsed = parse(body);
    String message = extractMessage(status, parsed);

    if (status == 401 && credentialsCall) {
      return new CredentialsException(message);
    }
    if (status == 403) {
      return ACCOUNT_DISABLED_CODE.equals(parsed.resolveCode())
          ? new AccountDisabledException(message)
          : new ForbiddenException(message);
    }
    return new ApiException(status, message);
  }

  /**
   * 응답을 받지 못한 전송 오류 분류
   *
   * <p>원인 체인을 따라가며 timeout, 연결 거부, DNS/오프라인 순으로 판별합니다. 이미 분류된 예외는 그대로 반환합니다.
   */
  public BaseException classifyTransport(Throwable error) {
    if (error instanceof BaseException be) {
      return be;
    }
    return new NetworkException(networkCodeOf(error), error);
  }

  /** 상태 코드와 본문에서 가장 구체적인 메시지를 고릅니다. */
  public String extractMessage(int status, BackendErrorBody body) {
    String validation = validationMessages(body.getErrors());
    if (!validation.isEmpty()) {
      return validation;
    }
    String message = textOf(body.getMessage());
    if (!message.isEmpty()) {
      return message;
    }
    String error = textOf(body.getError());
    if (!error.isEmpty()) {
      return error;
    }
    return STATUS_FALLBACKS.getOrDefault(status, String.format(DEFAULT_FALLBACK, status));
  }

  private BackendErrorBody parse(String body) {
    if (body == null || body.isBlank()) {
      return BackendErrorBody.EMPTY;
    }
    BackendErrorBody parsed =
        executor.executeOrDefault(
            () -> objectMapper.readValue(body, BackendErrorBody.class),
            BackendErrorBody.EMPTY,
            TaskContext.of("ErrorClassifier", "ParseBody"));
    return parsed != null ? parsed : BackendErrorBody.EMPTY;
  }

  private ErrorCode networkCodeOf(Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      // ConnectTimeoutException은 ConnectException 하위 타입이므로 timeout을 먼저 판별
      if (isTimeout(current)) {
        return PipelineErrorCode.NETWORK_TIMEOUT;
      }
      if (current instanceof ConnectException) {
        return PipelineErrorCode.NETWORK_CONNECTION_REFUSED;
      }
      if (current instanceof UnknownHostException || current instanceof NoRouteToHostException) {
        return PipelineErrorCode.NETWORK_OFFLINE;
      }
      current = current.getCause();
    }
    return PipelineErrorCode.NETWORK_UNAVAILABLE;
  }

  private boolean isTimeout(Throwable t) {
    return t instanceof TimeoutException
        || t instanceof SocketTimeoutException
        || t instanceof ReadTimeoutException
        || t instanceof WriteTimeoutException
        || t instanceof ConnectTimeoutException;
  }

  private String validationMessages(JsonNode errors) {
    if (errors == null || errors.isNull() || errors.isMissingNode()) {
      return "";
    }
    if (errors.isArray()) {
      return joinValues(errors, ", ");
    }
    if (errors.isObject()) {
      List<String> groups = new ArrayList<>();
      Iterator<JsonNode> fields = errors.elements();
      while (fields.hasNext()) {
        JsonNode field = fields.next();
        String group = field.isArray() ? joinValues(field, ", ") : textOf(field);
        if (!group.isEmpty()) {
          groups.add(group);
        }
      }
      return String.join("; ", groups);
    }
    return textOf(errors);
  }

  private String joinValues(JsonNode array, String delimiter) {
    List<String> values = new ArrayList<>();
    for (JsonNode element : array) {
      String text = textOf(element);
      if (!text.isEmpty()) {
        values.add(text);
      }
    }
    return String.join(delimiter, values);
  }

  private String textOf(JsonNode node) {
    if (node == null || !node.isValueNode() || node.isNull()) {
      return "";
    }
    return node.asText().trim();
  }
}
