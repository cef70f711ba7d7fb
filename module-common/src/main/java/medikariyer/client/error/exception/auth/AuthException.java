package medikariyer.client.error.exception.auth;

import medikariyer.client.error.ErrorCode;
import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.base.ClientBaseException;

/**
 * Terminal authentication failure.
 *
 * <p>Raised when the session cannot be recovered: a second 401 after the single retry, a 401 with
 * no refresh token, no usable token at all, or a device-binding mismatch. The surrounding
 * application is expected to navigate to the login screen.
 */
public class AuthException extends ClientBaseException {

  public AuthException() {
    super(PipelineErrorCode.SESSION_EXPIRED);
  }

  public AuthException(ErrorCode errorCode) {
    super(errorCode);
  }
}
