package de.bsommerfeld.widgetd.core.debounce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Open/closed flag that lets at most one trigger through per cooldown window.
 *
 * <p>
 * State machine: {@code OPEN --tryClose()--> CLOSED --cooldown--> OPEN}. Only
 * one of any number of concurrent {@link #tryClose()} calls wins the
 * transition; the winner's call also arms the timer that reopens the gate.
 * The timer runs independently of any further activity, so events arriving
 * while closed do not extend the window.
 */
public class DebounceGate {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMillis(500);

    private static final Logger LOG = LoggerFactory.getLogger(DebounceGate.class);

    private final AtomicBoolean open = new AtomicBoolean(true);
    private final Duration cooldown;
    private final ScheduledExecutorService timer;

    public DebounceGate(Duration cooldown, ScheduledExecutorService timer) {
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative: " + cooldown);
        }
        this.cooldown = cooldown;
        this.timer = timer;
    }

    /**
     * Closes the gate if it is open.
     *
     * @return {@code true} if this call performed the open-to-closed transition
     */
    public boolean tryClose() {
        if (!open.compareAndSet(true, false)) {
            return false;
        }
        try {
            timer.schedule(this::reopen, cooldown.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // no timer left to reopen us, stay usable
            LOG.warn("Debounce timer rejected the reopen task, reopening immediately");
            reopen();
        }
        return true;
    }

    public boolean isOpen() {
        return open.get();
    }

    public Duration getCooldown() {
        return cooldown;
    }

    void reopen() {
        open.set(true);
        LOG.trace("Debounce gate reopened");
    }
}
