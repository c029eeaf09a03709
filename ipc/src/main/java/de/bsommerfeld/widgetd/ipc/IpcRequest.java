package de.bsommerfeld.widgetd.ipc;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One client request, sent as a single JSON line.
 *
 * @param action one of {@code ping}, {@code reload}, {@code kill},
 *               {@code update}, {@code state}
 * @param vars   variables for {@code update}, otherwise empty
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IpcRequest(String action, Map<String, String> vars) {

    public static final String PING = "ping";
    public static final String RELOAD = "reload";
    public static final String KILL = "kill";
    public static final String UPDATE = "update";
    public static final String STATE = "state";

    public IpcRequest {
        vars = vars == null ? Map.of() : Map.copyOf(vars);
    }

    public static IpcRequest of(String action) {
        return new IpcRequest(action, Map.of());
    }
}
