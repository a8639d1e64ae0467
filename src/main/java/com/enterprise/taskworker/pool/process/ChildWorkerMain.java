package com.enterprise.taskworker.pool.process;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point of a spawned child JVM: {@code ChildWorkerMain <registry provider class>}.
 * Stdout carries the protocol, so it is taken over before anything can log to it.
 */
public final class ChildWorkerMain {
    
    private ChildWorkerMain() {
    }
    
    public static void main(String[] args) {
        PrintStream protocolOut = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        System.setOut(System.err);
        
        if (args.length != 1) {
            System.err.println("Usage: ChildWorkerMain <registry provider class>");
            System.exit(2);
        }
        
        int exitCode = new ChildWorker(protocolOut).run(args[0], System.in);
        System.exit(exitCode);
    }
}
