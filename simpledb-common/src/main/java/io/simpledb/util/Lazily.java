package io.simpledb.util;

import java.util.function.Supplier;

/**
 * Memoized suppliers. The lazy supplier replaces itself with a constant one on first access:
 *
 * <pre>
 * private Supplier&lt;Plan&gt; plan = Lazily.lazily(() -&gt; plan = Lazily.value(buildPlan()));
 * </pre>
 */
public class Lazily {

    @FunctionalInterface
    public interface Lazy<T> extends Supplier<T> {
        Supplier<T> init();

        default T get() {
            return init().get();
        }
    }

    public static <U> Supplier<U> lazily(Lazy<U> lazy) {
        return lazy;
    }

    public static <T> Supplier<T> value(T value) {
        return () -> value;
    }
}
