package io.simpledb.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import javax.annotation.Nullable;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.attr.AttributeReference;
import io.simpledb.query.expr.attr.Star;
import io.simpledb.query.expr.attr.UnresolvedAttribute;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;

import static io.simpledb.util.Trick.filterToList;

/**
 * Resolves column names of expressions against the schema of the plan node below them.
 */
public class Analyzer {
    private static final Logger logger = LoggerFactory.getLogger(Analyzer.class);

    private final Resolver resolver;

    public Analyzer(Resolver resolver) {
        this.resolver = resolver;
    }

    public Analyzer() {
        this(Resolver.caseInsensitiveResolution);
    }

    public Resolver resolver() {
        return resolver;
    }

    /**
     * Replaces every {@link UnresolvedAttribute} in {@code expr} with the matching field of {@code input}.
     *
     * @param relation the table the input was scanned from, it also qualifies the unqualified fields.
     */
    public Expression resolveExpression(Expression expr, StructType input, @Nullable String relation) {
        Expression resolved = expr.transformUp(e -> {
            if (e instanceof UnresolvedAttribute) {
                return resolveAttribute((UnresolvedAttribute) e, input, relation);
            }
            if (e instanceof Star) {
                throw new AnalysisException(ErrorCode.UNSUPPORTED_EXPRESSION,
                        "Invalid usage of '*' in expression " + expr.prettyString());
            }
            return e;
        });
        if (logger.isTraceEnabled() && resolved != expr) {
            logger.trace("Resolved {} to {}", expr.simpleString(), resolved.simpleString());
        }
        return resolved;
    }

    public AttributeReference resolveAttribute(UnresolvedAttribute attr, StructType input, @Nullable String relation) {
        List<StructField> candidates;
        if (attr.qualifier == null) {
            candidates = filterToList(input.fields(), f -> resolver.resolve(attr.name, f.name));
        } else {
            candidates = filterToList(input.fields(), f -> resolver.resolve(attr.name, f.name)
                    && (f.qualifier == null
                    ? relation != null && resolver.resolve(attr.qualifier, relation)
                    : resolver.resolve(attr.qualifier, f.qualifier)));
            if (candidates.size() > 1) {
                List<StructField> exact = filterToList(candidates,
                        f -> f.qualifier != null && resolver.resolve(attr.qualifier, f.qualifier));
                if (!exact.isEmpty()) {
                    candidates = exact;
                }
            }
        }
        if (candidates.isEmpty()) {
            throw AnalysisException.columnNotFound(attr.qualifiedName(), input.fieldNames());
        }
        if (candidates.size() > 1) {
            throw AnalysisException.ambiguousColumn(attr.qualifiedName(), candidates);
        }
        return AttributeReference.of(candidates.get(0));
    }
}
