package io.authkeys.credential;

import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the terminal. Worker tasks hand in a request and block on its answer;
 * requests are served one at a time on a single daemon thread, so two prompts
 * never share the screen.
 */
public final class PromptBroker implements AutoCloseable {
    private final TerminalPrompter terminal;
    private final ExecutorService owner;
    private volatile boolean closed;

    public PromptBroker(TerminalPrompter terminal) {
        this.terminal = terminal;
        this.owner = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "authkeys-prompt");
            thread.setDaemon(true);
            return thread;
        });
    }

    public String requestSecret(String prompt) throws PromptUnavailableException, InterruptedException {
        return await(() -> terminal.readSecret(prompt));
    }

    public boolean confirm(String question) throws PromptUnavailableException, InterruptedException {
        String answer = await(() -> terminal.readLine(question));
        String normalized = answer == null ? "" : answer.trim().toLowerCase(Locale.ROOT);
        return "y".equals(normalized) || "yes".equals(normalized);
    }

    public void notice(String message) throws PromptUnavailableException, InterruptedException {
        await(() -> {
            terminal.println(message);
            return null;
        });
    }

    public boolean isClosed() {
        return closed;
    }

    /** Stops issuing prompts. Queued requests are cancelled and their callers see {@link PromptUnavailableException}. */
    @Override
    public void close() {
        closed = true;
        for (Runnable pending : owner.shutdownNow()) {
            if (pending instanceof Future) {
                ((Future<?>) pending).cancel(true);
            }
        }
    }

    private <T> T await(Callable<T> request) throws PromptUnavailableException, InterruptedException {
        if (closed) {
            throw new PromptUnavailableException("Prompting is closed");
        }
        Future<T> future;
        try {
            future = owner.submit(request);
        } catch (RejectedExecutionException e) {
            throw new PromptUnavailableException("Prompting is closed", e);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (CancellationException e) {
            throw new PromptUnavailableException("Prompt cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PromptUnavailableException) {
                throw (PromptUnavailableException) cause;
            }
            throw new PromptUnavailableException("Prompt failed: " + cause.getMessage(), cause);
        }
    }
}
