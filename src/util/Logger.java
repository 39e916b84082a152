package util;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Console logging to standard error. Whether messages are printed is controlled by a stack of flags so a component
 * can silence (or re-enable) the output of the code it calls and restore the previous setting afterwards. Each thread
 * has its own stack.
 */
public class Logger {

    private static final ThreadLocal<Deque<Boolean>> stack = new ThreadLocal<Deque<Boolean>>() {
        @Override
        protected Deque<Boolean> initialValue() {
            Deque<Boolean> d = new ArrayDeque<>();
            d.push(Boolean.TRUE);
            return d;
        }
    };

    private Logger() {
        // static methods only
    }

    /**
     * @return true if messages printed now will appear
     */
    public static boolean isEnabled() {
        return stack.get().peek();
    }

    /**
     * Enable or disable logging until the matching {@link #pop()}
     *
     * @param enabled
     *            whether to print messages
     */
    public static void push(boolean enabled) {
        stack.get().push(enabled);
    }

    /**
     * Restore the setting in effect before the last {@link #push(boolean)}
     */
    public static void pop() {
        Deque<Boolean> d = stack.get();
        if (d.size() > 1) {
            d.pop();
        }
    }

    /**
     * Print a message on its own line, prefixed by the thread id
     *
     * @param s
     *            message
     */
    public static void println(String s) {
        if (isEnabled()) {
            System.err.println("[" + Thread.currentThread().getId() + "]" + s);
        }
    }

    /**
     * Print a formatted message on its own line
     *
     * @param format
     *            format string, see {@link String#format(String, Object...)}
     * @param args
     *            format arguments
     */
    public static void printf(String format, Object... args) {
        if (isEnabled()) {
            println(String.format(format, args));
        }
    }
}
