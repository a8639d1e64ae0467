package com.enterprise.taskworker.pool.process;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.exception.PoolStartException;
import com.enterprise.taskworker.pool.Execution;
import com.enterprise.taskworker.pool.SlotWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Parent side of one spawned child JVM
 */
public class SpawnedChildWorker implements SlotWorker {
    
    private static final Logger logger = LoggerFactory.getLogger(SpawnedChildWorker.class);
    
    private final int slotId;
    private final WorkerConfig.PoolConfig config;
    private final Listener listener;
    private final CountDownLatch handshake = new CountDownLatch(1);
    
    private Process process;
    private BufferedWriter writer;
    private volatile boolean ready = false;
    private volatile boolean killed = false;
    private volatile Execution current;
    private volatile long lastMemory = -1;
    
    public SpawnedChildWorker(int slotId, WorkerConfig.PoolConfig config, Listener listener) {
        this.slotId = slotId;
        this.config = config;
        this.listener = listener;
    }
    
    List<String> command() {
        List<String> command = new ArrayList<>();
        command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        command.addAll(config.getChildJvmOptions());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(ChildWorkerMain.class.getName());
        command.add(config.getRegistryProvider());
        return command;
    }
    
    @Override
    public void start() throws PoolStartException {
        try {
            process = new ProcessBuilder(command())
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        } catch (IOException e) {
            throw new PoolStartException("Could not launch a child JVM for slot " + slotId, e);
        }
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        
        Thread reader = new Thread(this::readLoop, "spawn-reader-" + slotId + "-" + process.pid());
        reader.setDaemon(true);
        reader.start();
        
        Duration timeout = config.getStartupTimeout();
        try {
            handshake.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!ready) {
            killed = true;
            process.destroyForcibly();
            throw new PoolStartException("Child JVM for slot " + slotId + " did not become ready within " + timeout);
        }
        logger.info("Slot {} child JVM started with pid {}", slotId, process.pid());
    }
    
    private void readLoop() {
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                ProtocolMessage message;
                try {
                    message = ProtocolMessage.fromJson(line);
                } catch (IOException e) {
                    logger.warn("Slot {} child wrote an unreadable line: {}", slotId, line);
                    continue;
                }
                if (ProtocolMessage.READY.equals(message.getType())) {
                    ready = true;
                    handshake.countDown();
                } else if (ProtocolMessage.RESULT.equals(message.getType())) {
                    handleResult(message);
                }
            }
        } catch (IOException e) {
            logger.debug("Pipe from slot {} child closed: {}", slotId, e.toString());
        }
        
        handshake.countDown();
        if (!killed) {
            listener.died(this, "Child JVM for slot " + slotId + " exited" + exitDescription());
        }
    }
    
    private void handleResult(ProtocolMessage message) {
        Execution execution = current;
        if (execution == null || !execution.getRequestId().equals(message.getRequestId())) {
            logger.warn("Slot {} child reported a result for {} which it is not running", slotId, message.getRequestId());
            return;
        }
        current = null;
        if (message.getMemoryBytes() != null) {
            lastMemory = message.getMemoryBytes();
        }
        listener.completed(this, execution, message.toOutcome());
    }
    
    private String exitDescription() {
        try {
            if (process.waitFor(1, TimeUnit.SECONDS)) {
                return " with code " + process.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "";
    }
    
    @Override
    public void run(Execution execution) throws IOException {
        TaskRequest request = execution.getRequest();
        current = execution;
        send(ProtocolMessage.run(request.getId(), request.getTaskName(), request.getBody(),
                                 request.getContentType(), request.getRetries()));
    }
    
    private void send(ProtocolMessage message) throws IOException {
        String line = message.toJson();
        synchronized (writer) {
            writer.write(line);
            writer.newLine();
            writer.flush();
        }
    }
    
    @Override
    public boolean isAlive() {
        return !killed && process != null && process.isAlive();
    }
    
    @Override
    public void signalSoftTimeout(Execution execution) {
        try {
            send(ProtocolMessage.softTimeout(execution.getRequestId()));
        } catch (IOException e) {
            logger.warn("Could not deliver the soft time limit to slot {} child: {}", slotId, e.toString());
        }
    }
    
    @Override
    public void kill() {
        killed = true;
        if (process != null) {
            process.destroyForcibly();
            logger.debug("Killed slot {} child {}", slotId, process.pid());
        }
    }
    
    @Override
    public void stop() {
        killed = true;
        if (process == null) {
            return;
        }
        try {
            send(ProtocolMessage.shutdown());
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (IOException e) {
            logger.debug("Slot {} child already gone: {}", slotId, e.toString());
            process.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
    
    @Override
    public OptionalLong memoryUsage() {
        long memory = lastMemory;
        return memory >= 0 ? OptionalLong.of(memory) : OptionalLong.empty();
    }
    
    @Override
    public OptionalLong pid() {
        return process != null ? OptionalLong.of(process.pid()) : OptionalLong.empty();
    }
}
