package com.ryuqq.sourcing.application.runtime;

/**
 * Background delivery runtime.
 *
 * <p>Implementations drain an external source of work (a command queue, the scheduled-command
 * store) one cycle at a time and hand each item to the trigger engine.</p>
 *
 * <p><strong>Cycle:</strong></p>
 * <pre>
 * pump()
 *   ↓
 * 1. Fetch a batch (queue messages or due scheduled commands)
 * 2. For each item: trigger the referenced scheduled commands
 * 3. Acknowledge what is durably resolved, leave the rest for redelivery
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
 * executor.scheduleWithFixedDelay(runtime::pump, 0, 100, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * <p>Per-item failures are handled inside the cycle; only infrastructure failures escape
 * {@link #pump()}.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Runs one cycle.
     *
     * @throws IllegalStateException if the runtime has been shut down
     */
    void pump();
}
