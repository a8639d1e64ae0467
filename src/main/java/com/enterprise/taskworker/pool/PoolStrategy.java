package com.enterprise.taskworker.pool;

import java.util.Locale;

/**
 * Execution strategies an {@link ExecutionPool} can be built with
 */
public enum PoolStrategy {
    
    PROCESS_FORK("process-fork"),
    PROCESS_SPAWN("process-spawn"),
    GREEN_THREAD("green-thread"),
    NATIVE_THREAD("native-thread"),
    SOLO("solo");
    
    private final String configName;
    
    PoolStrategy(String configName) {
        this.configName = configName;
    }
    
    public String getConfigName() {
        return configName;
    }
    
    /**
     * Resolve a strategy from its configuration name ({@code process-spawn})
     * or enum constant name ({@code PROCESS_SPAWN})
     */
    public static PoolStrategy fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Pool strategy name is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (PoolStrategy strategy : values()) {
            if (strategy.configName.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown pool strategy: " + name);
    }
    
    @Override
    public String toString() {
        return configName;
    }
}
