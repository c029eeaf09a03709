package de.bsommerfeld.widgetd.ipc;

import de.bsommerfeld.widgetd.core.command.DaemonResponse;

/**
 * The daemon's answer to an {@link IpcRequest}, sent as a single JSON line.
 */
public record IpcResponse(boolean success, String message) {

    public static IpcResponse ok(String message) {
        return new IpcResponse(true, message);
    }

    public static IpcResponse error(String message) {
        return new IpcResponse(false, message);
    }

    static IpcResponse from(DaemonResponse response) {
        return new IpcResponse(response.isSuccess(), response.text());
    }
}
