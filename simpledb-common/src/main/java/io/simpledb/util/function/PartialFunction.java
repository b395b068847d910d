package io.simpledb.util.function;

import java.util.function.Function;

/**
 * A function only defined on part of its domain, used by the tree rewriting rules.
 *
 * @param <A> argument type
 * @param <B> result type
 */
public interface PartialFunction<A, B> extends Function<A, B> {
    boolean isDefinedAt(A x);

    default B applyOrElse(A x, Function<? super A, ? extends B> that) {
        return isDefinedAt(x) ? apply(x) : that.apply(x);
    }

    static <A, B> PartialFunction<A, B> fromFunction(Function<? super A, ? extends B> f) {
        return new PartialFunction<A, B>() {
            @Override
            public boolean isDefinedAt(A x) {
                return true;
            }

            @Override
            public B apply(A a) {
                return f.apply(a);
            }
        };
    }
}
