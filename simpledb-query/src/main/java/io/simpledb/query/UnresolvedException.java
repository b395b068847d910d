package io.simpledb.query;

/**
 * Internal error: a method that needs a resolved tree was called on an unresolved one.
 */
public class UnresolvedException extends RuntimeException {
    public UnresolvedException(TreeNode<?> tree, String function) {
        super(String.format("Invalid call to %s on unresolved object %s", function, tree.simpleString()));
    }
}
