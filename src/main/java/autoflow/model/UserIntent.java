package autoflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Intent tag attached upstream (by the ingestion adapter or a labelling pass)
 * to an event whose raw kind is ambiguous.
 */
public enum UserIntent {
    @JsonProperty("copy_to_clipboard")    COPY_TO_CLIPBOARD,
    @JsonProperty("paste_from_clipboard") PASTE_FROM_CLIPBOARD,
    @JsonProperty("submit_input")         SUBMIT_INPUT,
    @JsonProperty("select_text_for_copy") SELECT_TEXT_FOR_COPY
}
