package com.efaktur.backend.util;

import com.efaktur.backend.exceptions.ValidationCancelledException;

public final class Cancellation {

    private Cancellation() {
    }

    /**
     * Aborts the current pipeline if its worker thread has been interrupted. The interrupt flag is left set.
     */
    public static void checkpoint(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ValidationCancelledException(stage);
        }
    }
}
