package com.automaker.core.state;

import com.automaker.core.agent.CancellationToken;
import com.automaker.core.model.AutoLoopConfig;

/**
 * State of one project's scheduler loop. Created on start, discarded on stop.
 */
public class ProjectAutoLoopState {

    private final AutoLoopConfig config;
    private final CancellationToken cancellation = new CancellationToken();
    private volatile boolean running = true;
    private volatile Thread thread;

    public ProjectAutoLoopState(AutoLoopConfig config) {
        this.config = config;
    }

    public AutoLoopConfig getConfig() { return config; }
    public CancellationToken getCancellation() { return cancellation; }
    public boolean isRunning() { return running; }
    public Thread getThread() { return thread; }
    public void setThread(Thread thread) { this.thread = thread; }

    /** Marks the loop stopped and wakes it from any sleep. */
    public void stop() {
        running = false;
        cancellation.cancel();
        Thread t = thread;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
    }
}
