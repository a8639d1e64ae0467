package com.enterprise.taskworker.examples;

import com.enterprise.taskworker.core.RetryPolicy;
import com.enterprise.taskworker.core.TaskArguments;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.core.TaskRegistryProvider;
import com.enterprise.taskworker.exception.DuplicateTaskException;

import java.time.Duration;

/**
 * Small task set used by the example and by process-pool children
 */
public class ExampleTasks implements TaskRegistryProvider {

    public static final String ADD = "add";
    public static final String MULTIPLY = "mul";
    public static final String IDENTITY = "identity";
    public static final String SLEEP = "sleep";
    public static final String RAISE_ERROR = "raise_error";
    public static final String HALT_PROCESS = "halt_process";
    public static final String SEND_EMAIL = "send_email";

    @Override
    public void registerTasks(TaskRegistry registry) throws DuplicateTaskException {
        registry.register(ADD, context -> number(context.getArguments(), 0, "x") + number(context.getArguments(), 1, "y"));
        registry.register(MULTIPLY, context -> number(context.getArguments(), 0, "x") * number(context.getArguments(), 1, "y"));
        registry.register(IDENTITY, context -> context.getArguments().get(0, "value"));

        registry.register(SLEEP, context -> {
            long millis = number(context.getArguments(), 0, "millis");
            Thread.sleep(millis);
            return millis;
        }, builder -> builder.retryPolicy(RetryPolicy.Predefined.noRetry()));

        registry.register(RAISE_ERROR, context -> {
            Object message = context.getArguments().get(0, "message");
            throw new IllegalStateException(message != null ? message.toString() : "requested failure");
        }, builder -> builder.retryPolicy(RetryPolicy.builder()
            .maxRetries(2)
            .baseDelay(Duration.ofMillis(50))
            .maxDelay(Duration.ofMillis(200))
            .jitter(false)
            .build()));

        // Ends the whole process; only meaningful in a process pool child
        registry.register(HALT_PROCESS, context -> {
            Runtime.getRuntime().halt(13);
            return null;
        }, builder -> builder.retryPolicy(RetryPolicy.Predefined.noRetry()));

        registry.register(SEND_EMAIL, new SendEmailHandler(), builder -> builder
            .retryPolicy(RetryPolicy.Predefined.networkRetry())
            .rateLimit("10/s"));
    }

    private static long number(TaskArguments arguments, int index, String name) {
        Object value = arguments.get(index, name);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Argument " + name + " must be a number, got " + value);
        }
        return ((Number) value).longValue();
    }
}
