package io.authkeys.observability;

import java.io.PrintStream;
import java.util.Map;

/** Prints one progress line per event, e.g. {@code [fetch] deploy@db1 ok keys=2}. */
public final class ConsoleReporter implements RunReporter {
    private final PrintStream out;

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void record(RunEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(event.action()).append(']');
        if (event.resource() != null) {
            sb.append(' ').append(event.resource());
        }
        if (event.result() != null) {
            sb.append(' ').append(event.result());
        }
        for (Map.Entry<String, Object> entry : event.details().entrySet()) {
            sb.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
        }
        synchronized (out) {
            out.println(sb);
        }
    }
}
