package com.webdoc.core.stage;

import com.webdoc.process.RunningProcess;

/**
 * Cancellation signal shared between the command path and one stage run.
 *
 * <p>The stage attaches each subprocess it launches; cancelling the token terminates whichever
 * subprocess is attached at that moment, and a subprocess attached after cancellation is
 * terminated as soon as it is attached.
 */
public final class CancellationToken {

    private RunningProcess attached;
    private boolean cancelled;

    public synchronized void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        if (attached != null) {
            attached.cancel();
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    synchronized void attach(RunningProcess process) {
        attached = process;
        if (cancelled) {
            process.cancel();
        }
    }

    synchronized void detach(RunningProcess process) {
        if (attached == process) {
            attached = null;
        }
    }
}
