package com.enterprise.taskworker.pool.thread;

import com.enterprise.taskworker.core.TaskContext;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.pool.Execution;
import com.enterprise.taskworker.pool.HandlerInvoker;
import com.enterprise.taskworker.pool.SlotWorker;

import java.util.concurrent.ThreadFactory;

/**
 * Starts a fresh short-lived thread for every execution
 */
public class GreenThreadWorker implements SlotWorker {
    
    private final ThreadFactory threads;
    private final Listener listener;
    private volatile Thread current;
    private volatile boolean killed = false;
    private volatile boolean crashed = false;
    
    public GreenThreadWorker(ThreadFactory threads, Listener listener) {
        this.threads = threads;
        this.listener = listener;
    }
    
    @Override
    public void start() {
    }
    
    @Override
    public void run(Execution execution) {
        Thread thread = threads.newThread(() -> execute(execution));
        current = thread;
        thread.start();
    }
    
    private void execute(Execution execution) {
        TaskOutcome outcome;
        try {
            outcome = HandlerInvoker.invoke(
                execution.getDefinition().getHandler(), execution.getRequest(), execution::attachContext);
        } catch (VirtualMachineError e) {
            crashed = true;
            throw e;
        }
        if (!killed) {
            listener.completed(this, execution, outcome);
        }
    }
    
    @Override
    public boolean isAlive() {
        return !killed && !crashed;
    }
    
    @Override
    public void signalSoftTimeout(Execution execution) {
        TaskContext context = execution.getContext();
        if (context != null) {
            context.signalSoftTimeLimit();
        }
        Thread thread = current;
        if (thread != null) {
            thread.interrupt();
        }
    }
    
    @Override
    public void kill() {
        killed = true;
        Thread thread = current;
        if (thread != null) {
            thread.interrupt();
        }
    }
    
    @Override
    public void stop() {
        killed = true;
    }
}
