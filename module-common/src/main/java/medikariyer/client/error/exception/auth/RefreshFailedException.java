package medikariyer.client.error.exception.auth;

import medikariyer.client.error.ErrorCode;
import medikariyer.client.error.exception.base.ServerBaseException;

/**
 * Refresh attempt failed (token missing or rejected, malformed response, transport failure,
 * deadline exceeded).
 *
 * <p>Handled inside the pipeline: credentials are cleared and the session is marked
 * unauthenticated. Callers only ever see the terminal {@link AuthException}.
 */
public class RefreshFailedException extends ServerBaseException {

  public RefreshFailedException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public RefreshFailedException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
