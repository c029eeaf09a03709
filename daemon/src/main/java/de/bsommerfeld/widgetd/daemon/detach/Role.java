package de.bsommerfeld.widgetd.daemon.detach;

/**
 * Which side of the detachment the current process is on.
 */
public enum Role {

    /**
     * The launching process. It has started the daemon and should exit with
     * status 0 right away.
     */
    PARENT,

    /**
     * The detached daemon process. Startup continues.
     */
    DAEMON
}
