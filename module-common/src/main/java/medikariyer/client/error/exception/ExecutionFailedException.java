package medikariyer.client.error.exception;

import medikariyer.client.error.PipelineErrorCode;
import medikariyer.client.error.exception.base.ServerBaseException;

/** Checked exception raised inside a LogicExecutor task, translated to unchecked. */
public class ExecutionFailedException extends ServerBaseException {

  public ExecutionFailedException(String taskName, Throwable cause) {
    super(PipelineErrorCode.INTERNAL_ERROR, cause, taskName);
  }
}
