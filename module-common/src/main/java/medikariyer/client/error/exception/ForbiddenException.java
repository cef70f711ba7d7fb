package medikariyer.client.error.exception;

import medikariyer.client.error.ErrorCode;
import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.base.ClientBaseException;

/**
 * HTTP 403. The session is valid but lacks permission, so this is never retried and never clears
 * the session.
 */
public class ForbiddenException extends ClientBaseException {

  public ForbiddenException(String message) {
    super(PipelineErrorCode.FORBIDDEN, message);
  }

  protected ForbiddenException(ErrorCode errorCode, String message) {
    super(errorCode, message);
  }
}
