package com.enterprise.taskworker.pool.process;

import com.enterprise.taskworker.core.ExceptionInfo;
import com.enterprise.taskworker.core.NamedThreadFactory;
import com.enterprise.taskworker.core.TaskContext;
import com.enterprise.taskworker.core.TaskDefinition;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.core.TaskRegistryProvider;
import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.exception.DuplicateTaskException;
import com.enterprise.taskworker.exception.UnknownTaskException;
import com.enterprise.taskworker.pool.HandlerInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Child side of the spawn protocol: reads commands from the parent, runs one task at a time
 * on its own thread and writes one result line per task.
 */
final class ChildWorker {
    
    private static final Logger logger = LoggerFactory.getLogger(ChildWorker.class);
    
    static final int EXIT_FATAL_ERROR = 70;
    static final int EXIT_BAD_REGISTRY = 3;
    
    private final PrintStream protocolOut;
    private final ExecutorService executor =
        Executors.newSingleThreadExecutor(new NamedThreadFactory("child-task-", true));
    
    private volatile String currentRequestId;
    private volatile Thread currentThread;
    private volatile TaskContext currentContext;
    
    ChildWorker(PrintStream protocolOut) {
        this.protocolOut = protocolOut;
    }
    
    int run(String providerClass, InputStream commands) {
        TaskRegistry loaded;
        try {
            loaded = TaskRegistryProvider.load(providerClass);
        } catch (ReflectiveOperationException | DuplicateTaskException | RuntimeException e) {
            logger.error("Cannot build the task registry from {}", providerClass, e);
            return EXIT_BAD_REGISTRY;
        }
        
        final TaskRegistry registry = loaded;
        long pid = ProcessHandle.current().pid();
        try {
            send(ProtocolMessage.ready(pid).toJson());
        } catch (IOException e) {
            logger.error("Cannot write the ready message", e);
            return EXIT_FATAL_ERROR;
        }
        logger.debug("Child {} ready with {} tasks", pid, registry.size());
        
        BufferedReader reader = new BufferedReader(new InputStreamReader(commands, StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                final ProtocolMessage message;
                try {
                    message = ProtocolMessage.fromJson(line);
                } catch (IOException e) {
                    logger.error("Unreadable command from parent: {}", line, e);
                    continue;
                }
                
                switch (message.getType()) {
                    case ProtocolMessage.RUN:
                        executor.execute(() -> execute(registry, message));
                        break;
                    case ProtocolMessage.SOFT_TIMEOUT:
                        signalSoftTimeout(message.getRequestId());
                        break;
                    case ProtocolMessage.SHUTDOWN:
                        logger.debug("Child {} shutting down", pid);
                        executor.shutdownNow();
                        return 0;
                    default:
                        logger.warn("Unknown command type {}", message.getType());
                }
            }
        } catch (IOException e) {
            logger.error("Lost the pipe from the parent", e);
            return 1;
        }
        logger.info("Parent closed the pipe, child {} exiting", pid);
        return 0;
    }
    
    private void execute(TaskRegistry registry, ProtocolMessage command) {
        TaskRequest request = TaskRequest.builder(command.getRequestId(), command.getTaskName())
            .body(command.getBody())
            .contentType(command.getContentType())
            .retries(command.getRetries() != null ? command.getRetries() : 0)
            .build();
        
        TaskOutcome outcome;
        try {
            TaskDefinition definition = registry.lookup(request.getTaskName());
            currentThread = Thread.currentThread();
            currentRequestId = request.getId();
            Thread.interrupted();
            outcome = HandlerInvoker.invoke(definition.getHandler(), request, context -> currentContext = context);
        } catch (UnknownTaskException e) {
            outcome = TaskOutcome.failure(ExceptionInfo.from(e), 0);
        } catch (VirtualMachineError e) {
            logger.error("Fatal error while running {}, exiting", request, e);
            Runtime.getRuntime().halt(EXIT_FATAL_ERROR);
            return;
        } finally {
            currentRequestId = null;
            currentContext = null;
            currentThread = null;
        }
        Thread.interrupted();
        
        Runtime runtime = Runtime.getRuntime();
        long usedMemory = runtime.totalMemory() - runtime.freeMemory();
        String line;
        try {
            line = ProtocolMessage.result(request.getId(), outcome, usedMemory).toJson();
        } catch (IOException e) {
            logger.warn("Result of {} is not JSON serializable", request, e);
            try {
                line = ProtocolMessage.result(request.getId(),
                    TaskOutcome.failure(ExceptionInfo.from(e), outcome.getRuntimeMs()), usedMemory).toJson();
            } catch (IOException unexpected) {
                logger.error("Cannot report the outcome of {}, exiting", request, unexpected);
                Runtime.getRuntime().halt(EXIT_FATAL_ERROR);
                return;
            }
        }
        send(line);
    }
    
    private void signalSoftTimeout(String requestId) {
        TaskContext context = currentContext;
        Thread thread = currentThread;
        if (requestId == null || !requestId.equals(currentRequestId)) {
            logger.debug("Soft time limit for {} arrived after it finished", requestId);
            return;
        }
        if (context != null) {
            context.signalSoftTimeLimit();
        }
        if (thread != null) {
            thread.interrupt();
        }
    }
    
    private void send(String line) {
        synchronized (protocolOut) {
            protocolOut.println(line);
            protocolOut.flush();
        }
    }
}
