package io.simpledb.query;

import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import io.simpledb.util.function.PartialFunction;

import static io.simpledb.util.Lazily.lazily;
import static io.simpledb.util.Lazily.value;
import static io.simpledb.util.Trick.concatToList;
import static io.simpledb.util.Trick.identity;
import static io.simpledb.util.Trick.mapToList;

/**
 * Base of plan and expression trees. Nodes are immutable, rewriting always builds new nodes.
 * <p>
 * Passing the list returned from {@link #children()} to {@link #withNewChildren(List)} must produce
 * a node that works exactly the same as this one.
 */
@SuppressWarnings("unchecked")
public abstract class TreeNode<BaseType extends TreeNode<BaseType>> {
    private Supplier<Set<BaseType>> childSet = lazily(() -> childSet = value(new HashSet<>(children())));

    public abstract List<BaseType> children();

    /** Returns a new instance with the given children, other fields are kept. */
    public abstract BaseType withNewChildren(List<BaseType> newChildren);

    /** The constructor arguments of this node, used for printing and semantic comparison. */
    public abstract List<Object> args();

    public boolean containsChild(TreeNode<?> child) {
        return childSet.get().contains(child);
    }

    /**
     * Short-circuits when both nodes are the same instance.
     */
    public boolean fastEquals(TreeNode<?> other) {
        return this == other || this.equals(other);
    }

    /**
     * Finds the first node that satisfies {@code p}, in pre-order.
     */
    public BaseType find(Predicate<? super BaseType> p) {
        if (p.test((BaseType) this)) {
            return (BaseType) this;
        }
        for (BaseType c : children()) {
            BaseType found = c.find(p);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /** Runs {@code f} on this node and then recursively on the children. */
    public void foreach(Consumer<? super BaseType> f) {
        f.accept((BaseType) this);
        children().forEach(c -> c.foreach(f));
    }

    /** Collects the non-null results of {@code f} over the tree, in pre-order. */
    public <A> List<A> collect(Function<BaseType, A> f) {
        List<A> list = new ArrayList<>();
        this.foreach(node -> {
            A res = f.apply(node);
            if (res != null) list.add(res);
        });
        return list;
    }

    public BaseType transform(Function<BaseType, BaseType> rule) {
        return transformDown(PartialFunction.fromFunction(rule));
    }

    public BaseType transformDown(PartialFunction<BaseType, BaseType> rule) {
        BaseType afterRule = rule.applyOrElse((BaseType) this, identity());
        if (this.fastEquals(afterRule)) {
            return transformChildren(rule, TreeNode::transformDown);
        } else {
            return afterRule.transformChildren(rule, TreeNode::transformDown);
        }
    }

    public BaseType transformDown(Function<BaseType, BaseType> rule) {
        return transformDown(PartialFunction.fromFunction(rule));
    }

    public BaseType transformUp(PartialFunction<BaseType, BaseType> rule) {
        BaseType afterRuleOnChildren = transformChildren(rule, TreeNode::transformUp);
        return rule.applyOrElse(afterRuleOnChildren, identity());
    }

    public BaseType transformUp(Function<BaseType, BaseType> rule) {
        return transformUp(PartialFunction.fromFunction(rule));
    }

    protected BaseType transformChildren(PartialFunction<BaseType, BaseType> f,
                                         BiFunction<BaseType, PartialFunction<BaseType, BaseType>, BaseType> nextOperation) {
        List<BaseType> newChildren = new ArrayList<>();
        boolean updated = false;
        for (BaseType child : children()) {
            BaseType newChild = nextOperation.apply(child, f);
            if (!child.fastEquals(newChild)) {
                updated = true;
            }
            newChildren.add(newChild);
        }
        return updated ? withNewChildren(newChildren) : (BaseType) this;
    }

    /** Returns the name of this type of node. Defaults to the class name. */
    public String nodeName() {
        return getClass().getSimpleName();
    }

    /** Returns a string representing the arguments to this node, minus any children. */
    public String argString() {
        return StringUtils.join(mapToList(args(), arg -> {
            if (arg instanceof TreeNode) {
                if (containsChild((TreeNode<?>) arg)) {
                    return null;
                }
                return ((TreeNode<?>) arg).simpleString();
            }
            if (arg instanceof Collection) {
                if (!((Collection<?>) arg).isEmpty() && childSet.get().containsAll((Collection<?>) arg)) {
                    return null;
                }
                return "[" + StringUtils.join((Collection<?>) arg, ", ") + "]";
            }
            return arg;
        }, /*ignoreNull*/true), ", ");
    }

    /** One line representation of this node without its children. */
    public String simpleString() {
        return (nodeName() + " " + argString()).trim();
    }

    @Override
    public String toString() {
        return treeString();
    }

    /** Returns a string representation of the nodes in this tree. */
    public String treeString() {
        return generateTreeString(0, Collections.emptyList(), new StringBuilder()).toString();
    }

    /**
     * Appends this node and its children to {@code builder}.
     * <p>
     * The i-th element of {@code lastChildren} tells whether the ancestor at depth i + 1 is the last
     * child of its own parent. The root has an empty list.
     */
    StringBuilder generateTreeString(int depth, List<Boolean> lastChildren, StringBuilder builder) {
        if (depth > 0) {
            lastChildren.subList(0, lastChildren.size() - 1).forEach(isLast -> builder.append(isLast ? "   " : ":  "));
            builder.append(lastChildren.get(lastChildren.size() - 1) ? "+- " : ":- ");
        }

        builder.append(simpleString());
        builder.append("\n");

        List<BaseType> children = children();
        if (!children.isEmpty()) {
            children.subList(0, children.size() - 1).forEach(c -> c.generateTreeString(
                    depth + 1, concatToList(lastChildren, false), builder));
            children.get(children.size() - 1).generateTreeString(
                    depth + 1, concatToList(lastChildren, true), builder);
        }
        return builder;
    }
}
