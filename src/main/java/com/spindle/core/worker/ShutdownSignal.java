package com.spindle.core.worker;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide termination signal observed by every worker and by the initializer.
 * <p>
 * Once requested it stays requested.
 */
@Component
public class ShutdownSignal {

    private final AtomicBoolean requested = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Requests shutdown.
     *
     * @return true for the call that actually flipped the signal
     */
    public boolean request() {
        boolean first = requested.compareAndSet(false, true);
        latch.countDown();
        return first;
    }

    public boolean isRequested() {
        return requested.get();
    }

    /**
     * Waits up to {@code timeout} for shutdown to be requested.
     *
     * @return true if shutdown was requested before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isRequested();
        }
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
