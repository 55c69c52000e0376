package autoflow.model;

import autoflow.AutoflowException;

/**
 * Thrown when a workflow or one of its steps does not have the required shape:
 * for example a missing field or a selector on a keyboard step.
 */
public class WorkflowSchemaException extends AutoflowException {

    public WorkflowSchemaException(String msg) {
        super(msg);
    }

    public WorkflowSchemaException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
