package de.bsommerfeld.widgetd.core.command;

/**
 * Answer to a {@link DaemonCommand.WithResponse}, delivered over its
 * {@link ResponseChannel}.
 */
public interface DaemonResponse {

    boolean isSuccess();

    /**
     * Payload on success, error message on failure.
     */
    String text();

    static DaemonResponse success(String payload) {
        return new Success(payload);
    }

    static DaemonResponse failure(String message) {
        return new Failure(message);
    }

    record Success(String payload) implements DaemonResponse {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String text() {
            return payload;
        }
    }

    record Failure(String message) implements DaemonResponse {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String text() {
            return message;
        }
    }
}
