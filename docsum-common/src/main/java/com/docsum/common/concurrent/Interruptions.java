package com.docsum.common.concurrent;

/**
 * Blocking bridges such as Reactor's {@code block()} report an interrupt as an unchecked
 * exception wrapping {@link InterruptedException} and clear the thread's interrupt flag.
 */
public final class Interruptions {

    private Interruptions() {}

    /**
     * True if the current thread is interrupted or {@code error} was caused by an interrupt.
     */
    public static boolean isInterruption(Throwable error) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }
}
