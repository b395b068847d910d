package io.simpledb.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Collection shortcuts used all over the planner code, mostly to keep the tree rewriting readable.
 */
public class Trick {

    public static <T> Function<T, T> identity() {
        return x -> x;
    }

    public static <T> T find(Collection<T> c, Predicate<? super T> where) {
        for (T t : c) {
            if (where.test(t)) {
                return t;
            }
        }
        return null;
    }

    public static <T> int indexWhere(List<T> list, Predicate<? super T> where) {
        int i = 0;
        for (T t : list) {
            if (where.test(t)) {
                return i;
            }
            i++;
        }
        return -1;
    }

    public static <T> boolean forAll(Collection<T> c, Predicate<? super T> p) {
        for (T t : c) {
            if (!p.test(t)) {
                return false;
            }
        }
        return true;
    }

    @SafeVarargs
    public static <E> List<E> concatToList(Collection<? extends E> c, Collection<? extends E>... others) {
        ArrayList<E> list = new ArrayList<>(c);
        for (Collection<? extends E> oc : others) {
            list.addAll(oc);
        }
        return list;
    }

    @SafeVarargs
    public static <E> List<E> concatToList(Collection<? extends E> c, E... e) {
        ArrayList<E> list = new ArrayList<>(c);
        Collections.addAll(list, e);
        return list;
    }

    private static boolean is(boolean... v) {
        return v.length > 0 && v[0];
    }

    public static <T, R> List<R> mapToList(Collection<T> c, Function<? super T, ? extends R> mapper, boolean... ignoreNull) {
        if (is(ignoreNull)) {
            return c.stream().map(mapper).filter(r -> r != null).collect(Collectors.toList());
        } else {
            return c.stream().map(mapper).collect(Collectors.toList());
        }
    }

    public static <T> List<T> filterToList(Collection<T> c, Predicate<? super T> f) {
        return c.stream().filter(f).collect(Collectors.toList());
    }

    public static <T, R> List<R> flatMapToList(Collection<T> c, Function<? super T, ? extends Collection<? extends R>> mapper) {
        List<R> list = new ArrayList<>();
        for (T t : c) {
            Collection<? extends R> rs = mapper.apply(t);
            if (rs != null) {
                list.addAll(rs);
            }
        }
        return list;
    }

    /**
     * Keeps the first element of each group of elements considered equal by {@code same}, in encounter order.
     */
    public static <T> List<T> distinctBy(Collection<T> c, java.util.function.BiPredicate<? super T, ? super T> same) {
        List<T> res = new ArrayList<>();
        for (T t : c) {
            if (find(res, r -> same.test(r, t)) == null) {
                res.add(t);
            }
        }
        return res;
    }
}
