package com.enterprise.taskworker.pool;

import com.enterprise.taskworker.core.ExceptionInfo;
import com.enterprise.taskworker.core.TaskArguments;
import com.enterprise.taskworker.core.TaskContext;
import com.enterprise.taskworker.core.TaskHandler;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.exception.RejectTaskException;
import com.enterprise.taskworker.exception.RetryTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs a handler on the calling thread and turns whatever it does into an outcome.
 * {@link VirtualMachineError}s are the only throwables that escape.
 */
public final class HandlerInvoker {
    
    private static final Logger logger = LoggerFactory.getLogger(HandlerInvoker.class);
    
    private HandlerInvoker() {
    }
    
    public static TaskOutcome invoke(TaskHandler handler, TaskRequest request, Consumer<TaskContext> contextSink) {
        long start = System.nanoTime();
        try {
            TaskArguments arguments = request.getArguments();
            TaskContext context = new TaskContext(request.getId(), request.getTaskName(), request.getRetries(), arguments);
            contextSink.accept(context);
            
            Object result = handler.handle(context);
            logger.debug("Handler for {} returned after {}ms", request, elapsedMillis(start));
            return TaskOutcome.success(result, elapsedMillis(start));
            
        } catch (RetryTaskException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.debug("Handler for {} requested a retry: {}", request, cause.toString());
            return TaskOutcome.retryRequested(ExceptionInfo.from(cause), e.getCountdown(), elapsedMillis(start));
            
        } catch (RejectTaskException e) {
            logger.debug("Handler for {} requested a reject (requeue={})", request, e.isRequeue());
            return TaskOutcome.rejectRequested(ExceptionInfo.from(e), e.isRequeue(), elapsedMillis(start));
            
        } catch (VirtualMachineError e) {
            throw e;
            
        } catch (Exception | Error e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.debug("Handler for {} failed: {}", request, e.toString());
            return TaskOutcome.failure(ExceptionInfo.from(e), elapsedMillis(start));
        }
    }
    
    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
