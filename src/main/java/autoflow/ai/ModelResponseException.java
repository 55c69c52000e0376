package autoflow.ai;

import autoflow.AutoflowException;

/**
 * Thrown when the model's answer does not contain a parseable workflow.
 * The raw response text is kept for diagnosis.
 */
public class ModelResponseException extends AutoflowException {

    private final String rawResponse;

    public ModelResponseException(String msg, String rawResponse) {
        super(msg);
        this.rawResponse = rawResponse;
    }

    public ModelResponseException(String msg, String rawResponse, Throwable cause) {
        super(msg, cause);
        this.rawResponse = rawResponse;
    }

    /** The unmodified text returned by the model. */
    public String getRawResponse() { return rawResponse; }
}
