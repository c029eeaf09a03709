package de.bsommerfeld.widgetd.daemon.detach;

public enum StandardStream {

    STDOUT(1),
    STDERR(2);

    private final int descriptor;

    StandardStream(int descriptor) {
        this.descriptor = descriptor;
    }

    public int getDescriptor() {
        return descriptor;
    }
}
