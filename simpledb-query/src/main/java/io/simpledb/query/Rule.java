package io.simpledb.query;

/**
 * A tree rewrite. Rules never change the result of the tree, only its shape.
 */
@FunctionalInterface
public interface Rule<TreeType extends TreeNode<TreeType>> {
    TreeType apply(TreeType plan);

    /** Name for this rule, inferred from the class name. */
    default String ruleName() {
        return this.getClass().getSimpleName();
    }
}
