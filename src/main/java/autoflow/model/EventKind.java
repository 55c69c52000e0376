package autoflow.model;

/**
 * Closed set of primitive interaction kinds a recorder can emit.
 * The attributes each kind populates in {@link EventData} are listed per constant.
 */
public enum EventKind {

    /** x, y, button, element_name, element_type, automation_id. */
    MOUSE_CLICK,

    /** x, y, element_name, element_type. */
    MOUSE_DOUBLE_CLICK,

    /** start_x, start_y, end_x, end_y. */
    MOUSE_DRAG,

    /** x, y, delta_x, delta_y. */
    SCROLL,

    /** text, element_name; grouped_from after simplification. */
    TEXT_INPUT,

    /** key. */
    KEY_PRESS,

    /** keys, clipboard_content. */
    KEY_COMBINATION,

    /** url. */
    NAVIGATION,

    /** Reference point only; never compiled into a step. */
    SCREENSHOT
}
