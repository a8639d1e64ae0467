package com.enterprise.taskworker.core;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory producing numbered threads with a common prefix
 */
public class NamedThreadFactory implements ThreadFactory {
    
    private final AtomicLong threadNumber = new AtomicLong(1);
    private final String namePrefix;
    private final boolean daemon;
    private final long stackSize;
    
    public NamedThreadFactory(String namePrefix, boolean daemon) {
        this(namePrefix, daemon, 0);
    }
    
    /**
     * @param stackSize requested stack size in bytes, 0 for the JVM default
     */
    public NamedThreadFactory(String namePrefix, boolean daemon, long stackSize) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
        this.stackSize = stackSize;
    }
    
    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(null, r, namePrefix + threadNumber.getAndIncrement(), stackSize);
        t.setDaemon(daemon);
        t.setPriority(Thread.NORM_PRIORITY);
        return t;
    }
}
