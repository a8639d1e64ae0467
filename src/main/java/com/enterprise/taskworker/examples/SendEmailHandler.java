package com.enterprise.taskworker.examples;

import com.enterprise.taskworker.core.TaskArguments;
import com.enterprise.taskworker.core.TaskContext;
import com.enterprise.taskworker.core.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Example handler that pretends to send an email.
 * Fails now and then with an {@link IOException} so the network retry policy kicks in.
 */
public class SendEmailHandler implements TaskHandler {

    private static final Logger logger = LoggerFactory.getLogger(SendEmailHandler.class);

    @Override
    public Object handle(TaskContext context) throws Exception {
        TaskArguments arguments = context.getArguments();
        Object recipient = arguments.get(0, "recipient");
        Object subject = arguments.get(1, "subject");
        Object body = arguments.get(2, "body");

        if (recipient == null || subject == null || body == null) {
            // retrying cannot fix a malformed request
            throw context.reject("Missing required email fields", false);
        }

        logger.info("Sending email to {} with subject: {} (attempt {})", recipient, subject, context.getRetries() + 1);
        Thread.sleep(100 + ThreadLocalRandom.current().nextInt(200));
        context.checkSoftTimeLimit();

        if (ThreadLocalRandom.current().nextDouble() < 0.1) {
            throw new IOException("SMTP server unavailable");
        }

        logger.debug("Email sent to {}: {}", recipient, subject);
        return Map.of(
            "status", "sent",
            "recipient", recipient,
            "subject", subject,
            "timestamp", System.currentTimeMillis()
        );
    }
}
