package org.symdbg;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The one thread that symbol and breakpoint state is touched from. Replies from the agent arrive on transport
 * threads and are posted here with {@link #execute}.
 */
public class MessageLoop implements Executor {
    private final LinkedBlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();
    private volatile boolean quit;

    @Override
    public void execute(Runnable task) {
        tasks.add(task);
    }

    /** Run tasks until the queue is empty, including tasks posted by those tasks. Returns how many ran. */
    public int runUntilIdle() {
        var count = 0;
        for (var next = tasks.poll(); next != null; next = tasks.poll()) {
            runTask(next);
            count++;
        }
        return count;
    }

    /** Run tasks on the calling thread until {@link #quit()}. */
    public void run() {
        LOG.info("Running message loop...");
        while (!quit) {
            try {
                runTask(tasks.take());
            } catch (InterruptedException e) {
                LOG.warning("Message loop interrupted");
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    public void quit() {
        quit = true;
        tasks.add(() -> {});
    }

    public int pendingTasks() {
        return tasks.size();
    }

    private void runTask(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e.getMessage(), e);
        }
    }

    private static final Logger LOG = Logger.getLogger("main");
}
