package ai.attackframework.tools.textedit.utils.text;

/**
 * Yield point used by long-running bulk edits so the host UI can process pending events
 * between substitutions. Implementations must not start concurrent work.
 */
@FunctionalInterface
public interface EventPump {

    /** Pump that never yields. */
    EventPump NONE = () -> { };

    /** Process pending host events, then return. */
    void yieldToHost();
}
