package com.spindle.core.worker;

/**
 * The registry's reference to a worker's thread.
 *
 * @param id     the worker id
 * @param thread the thread executing the {@link Worker}
 */
record WorkerHandle(WorkerId id, Thread thread) {

    /**
     * Waits for the worker thread to end.
     *
     * @return true if the thread ended, false if the waiting thread was interrupted
     *         (its interrupt flag is restored)
     */
    boolean join() {
        try {
            thread.join();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
