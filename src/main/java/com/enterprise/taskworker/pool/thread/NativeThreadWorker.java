package com.enterprise.taskworker.pool.thread;

import com.enterprise.taskworker.core.TaskContext;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.pool.Execution;
import com.enterprise.taskworker.pool.HandlerInvoker;
import com.enterprise.taskworker.pool.SlotWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * One long-lived platform thread fed through a mailbox.
 * A killed worker's thread is interrupted and abandoned; if it ever finishes,
 * its result is dropped.
 */
public class NativeThreadWorker implements SlotWorker {
    
    private static final Logger logger = LoggerFactory.getLogger(NativeThreadWorker.class);
    
    private final String threadName;
    private final Listener listener;
    private final BlockingQueue<Execution> mailbox = new LinkedBlockingQueue<>();
    private volatile boolean stopped = false;
    private Thread thread;
    
    public NativeThreadWorker(String threadName, Listener listener) {
        this.threadName = threadName;
        this.listener = listener;
    }
    
    @Override
    public void start() {
        thread = new Thread(this::loop, threadName);
        // abandoned threads must not keep the JVM alive
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> logger.error("Worker thread {} died", t.getName(), e));
        thread.start();
    }
    
    @Override
    public void run(Execution execution) {
        mailbox.offer(execution);
    }
    
    private void loop() {
        while (!stopped) {
            Execution execution;
            try {
                execution = mailbox.take();
            } catch (InterruptedException e) {
                // stray soft-limit interrupt or stop(); the loop condition decides
                continue;
            }
            // clear a soft-limit interrupt aimed at the previous execution
            Thread.interrupted();
            
            TaskOutcome outcome = HandlerInvoker.invoke(
                execution.getDefinition().getHandler(), execution.getRequest(), execution::attachContext);
            
            Thread.interrupted();
            if (!stopped) {
                listener.completed(this, execution, outcome);
            }
        }
        logger.debug("Worker thread {} exiting", threadName);
    }
    
    @Override
    public boolean isAlive() {
        return !stopped && thread != null && thread.isAlive();
    }
    
    @Override
    public void signalSoftTimeout(Execution execution) {
        TaskContext context = execution.getContext();
        if (context != null) {
            context.signalSoftTimeLimit();
        }
        thread.interrupt();
    }
    
    @Override
    public void kill() {
        stopped = true;
        if (thread != null) {
            thread.interrupt();
        }
    }
    
    @Override
    public void stop() {
        kill();
    }
}
