package autoflow.model;

/**
 * Closed set of actions a workflow step can ask the replay engine to perform.
 */
public enum ActionType {
    CLICK, RIGHT_CLICK, DOUBLE_CLICK,
    TYPE_TEXT, PRESS_KEY, KEY_COMBINATION,
    SCROLL, DRAG, WAIT, NAVIGATE;

    /** Keyboard actions never carry a selector. */
    public boolean isKeyboard() {
        return this == TYPE_TEXT || this == PRESS_KEY || this == KEY_COMBINATION;
    }

    /** Mouse actions always carry a selector. */
    public boolean isMouse() {
        return this == CLICK || this == RIGHT_CLICK || this == DOUBLE_CLICK
                || this == DRAG || this == SCROLL;
    }

    public boolean isClickFamily() {
        return this == CLICK || this == RIGHT_CLICK || this == DOUBLE_CLICK;
    }
}
