package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all cronlite examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== cronlite Examples ===\n");

        // Run all examples
        BasicExample.main(args);
        ScheduledJobsExample.main(args);
        RecoveryExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
