package io.simpledb.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public abstract class RuleExecutor<TreeType extends TreeNode<TreeType>> {
    private static final Logger log = LoggerFactory.getLogger(RuleExecutor.class);

    /**
     * How many times a batch may run. A batch also stops once an iteration leaves the tree unchanged.
     */
    public static class Strategy {
        public final int maxIterations;

        public Strategy(int maxIterations) {
            this.maxIterations = maxIterations;
        }
    }

    /** Runs a batch exactly one time. */
    public static final Strategy Once = new Strategy(1);

    /** A batch of rules. */
    public class Batch {
        public final String name;
        public final Strategy strategy;
        public final List<Rule<TreeType>> rules;

        public Batch(String name, Strategy strategy, List<Rule<TreeType>> rules) {
            this.name = name;
            this.strategy = strategy;
            this.rules = rules;
        }
    }

    /** Defines a sequence of rule batches, to be overridden by the implementation. */
    protected abstract List<Batch> batches();

    /**
     * Executes the batches serially using their strategies. Within each batch, rules are also
     * executed serially.
     */
    public TreeType execute(TreeType thePlan) {
        TreeType curPlan = thePlan;
        for (Batch batch : batches()) {
            TreeType batchStartPlan = curPlan;
            int iteration = 1;
            while (true) {
                TreeType lastPlan = curPlan;
                for (Rule<TreeType> rule : batch.rules) {
                    TreeType result = rule.apply(curPlan);
                    if (!result.fastEquals(curPlan)) {
                        log.trace("Applying rule {}", rule.ruleName());
                    }
                    curPlan = result;
                }
                if (curPlan.fastEquals(lastPlan)) {
                    log.trace("Fixed point reached for batch {} after {} iterations.", batch.name, iteration);
                    break;
                }
                if (iteration >= batch.strategy.maxIterations) {
                    if (batch.strategy.maxIterations != 1) {
                        log.info("Max iterations ({}) reached for batch {}", iteration, batch.name);
                    }
                    break;
                }
                iteration++;
            }

            if (!batchStartPlan.fastEquals(curPlan)) {
                log.debug("Batch {} changed the plan:\n{}", batch.name, curPlan.treeString());
            } else {
                log.trace("Batch {} has no effect.", batch.name);
            }
        }
        return curPlan;
    }
}
