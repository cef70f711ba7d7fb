package medikariyer.client.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum PipelineErrorCode implements ErrorCode {
  // === Transport (no response received) ===
  NETWORK_TIMEOUT(
      "N001",
      "The request timed out. Check your connection and try again.",
      HttpStatus.GATEWAY_TIMEOUT,
      ErrorKind.NETWORK),
  NETWORK_CONNECTION_REFUSED(
      "N002",
      "Could not connect to the server. It may be temporarily unavailable.",
      HttpStatus.SERVICE_UNAVAILABLE,
      ErrorKind.NETWORK),
  NETWORK_OFFLINE(
      "N003",
      "The server could not be reached. Check your internet connection.",
      HttpStatus.SERVICE_UNAVAILABLE,
      ErrorKind.NETWORK),
  NETWORK_UNAVAILABLE(
      "N004",
      "Could not reach the server. Please try again.",
      HttpStatus.SERVICE_UNAVAILABLE,
      ErrorKind.NETWORK),

  // === Session ===
  SESSION_EXPIRED(
      "A001",
      "Your session has expired. Please log in again.",
      HttpStatus.UNAUTHORIZED,
      ErrorKind.AUTH),
  NO_USABLE_TOKEN("A002", "You are not signed in.", HttpStatus.UNAUTHORIZED, ErrorKind.AUTH),
  DEVICE_BINDING_MISMATCH(
      "A003",
      "Stored credentials belong to another device. Please log in again.",
      HttpStatus.UNAUTHORIZED,
      ErrorKind.AUTH),
  INVALID_CREDENTIALS("A004", "%s", HttpStatus.UNAUTHORIZED, ErrorKind.CREDENTIALS),
  FORBIDDEN("A005", "%s", HttpStatus.FORBIDDEN, ErrorKind.FORBIDDEN),
  ACCOUNT_DISABLED("A006", "%s", HttpStatus.FORBIDDEN, ErrorKind.ACCOUNT_DISABLED),

  // === Refresh (handled inside the pipeline, never surfaced as-is) ===
  REFRESH_TOKEN_MISSING(
      "R001", "No refresh token available", HttpStatus.UNAUTHORIZED, ErrorKind.AUTH),
  REFRESH_RESPONSE_MALFORMED(
      "R002", "Refresh response is missing %s", HttpStatus.BAD_GATEWAY, ErrorKind.AUTH),
  REFRESH_REJECTED("R003", "Refresh call failed (%s)", HttpStatus.UNAUTHORIZED, ErrorKind.AUTH),
  REFRESH_TIMEOUT(
      "R004", "Refresh did not complete within %s", HttpStatus.GATEWAY_TIMEOUT, ErrorKind.AUTH),
  REFRESH_ABANDONED(
      "R005", "Refresh attempt was abandoned", HttpStatus.UNAUTHORIZED, ErrorKind.AUTH),

  // === API ===
  API_ERROR("E001", "%s", HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.API),
  INTERNAL_ERROR(
      "S001", "Internal client error (%s)", HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.API);

  private final String code;
  private final String message;
  private final HttpStatus status;
  private final ErrorKind kind;
}
