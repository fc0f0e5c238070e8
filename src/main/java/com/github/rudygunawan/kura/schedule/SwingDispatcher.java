package com.github.rudygunawan.kura.schedule;

import javax.swing.SwingUtilities;
import java.util.Objects;

/**
 * Dispatches onto the AWT event dispatch thread, for Swing desktop hosts.
 */
public enum SwingDispatcher implements MainThreadDispatcher {
    INSTANCE;

    @Override
    public boolean isMainThread() {
        return SwingUtilities.isEventDispatchThread();
    }

    @Override
    public void post(Runnable task) {
        SwingUtilities.invokeLater(Objects.requireNonNull(task, "task cannot be null"));
    }
}
