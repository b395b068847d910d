package io.simpledb.query.sql;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import io.simpledb.query.Analyzer;
import io.simpledb.query.catalog.Catalog;
import io.simpledb.query.catalog.TableSource;
import io.simpledb.query.expr.BinaryExpression;
import io.simpledb.query.expr.BinaryOperator;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.Literal;
import io.simpledb.query.expr.agg.AggregateFunction;
import io.simpledb.query.expr.agg.Count;
import io.simpledb.query.expr.attr.Alias;
import io.simpledb.query.expr.attr.AttributeReference;
import io.simpledb.query.expr.attr.Star;
import io.simpledb.query.expr.attr.UnresolvedAttribute;
import io.simpledb.query.parsers.SimpleSqlLexer;
import io.simpledb.query.parsers.SimpleSqlParser;
import io.simpledb.query.plan.logical.DataFrame;
import io.simpledb.query.plan.logical.LogicalPlan;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;
import io.simpledb.util.ExtraStringUtil;

import static io.simpledb.util.Trick.distinctBy;
import static io.simpledb.util.Trick.indexWhere;
import static io.simpledb.util.Trick.mapToList;

/**
 * Turns statement text into a logical plan. Tables are looked up in the catalog and every column
 * is resolved while the plan is built, in the order Scan, Filter, Aggregate, Project, Limit.
 */
public class SqlPlanner {
    private static final Logger logger = LoggerFactory.getLogger(SqlPlanner.class);

    private final Catalog catalog;
    private final Analyzer analyzer;

    public SqlPlanner(Catalog catalog, Analyzer analyzer) {
        this.catalog = catalog;
        this.analyzer = analyzer;
    }

    /**
     * A parsed statement.
     */
    public static class Statement {
        public final boolean explain;
        public final LogicalPlan plan;

        public Statement(boolean explain, LogicalPlan plan) {
            this.explain = explain;
            this.plan = plan;
        }
    }

    public Statement plan(String sql) {
        SimpleSqlParser.StatementContext statement = parse(sql).statement();
        LogicalPlan plan = planSelect(statement.selectStatement());
        logger.debug("Logical plan of [{}]:\n{}", sql, plan.treeString());
        return new Statement(statement.EXPLAIN() != null, plan);
    }

    private LogicalPlan planSelect(SimpleSqlParser.SelectStatementContext select) {
        TableSource table = catalog.lookupTable(identifierText(select.tableName().identifier()));
        DataFrame df = DataFrame.scan(table, analyzer);

        if (select.whereClause() != null) {
            df = df.filter(parseExpr(select.whereClause().expression()));
        }

        List<Expression> selectExprs = outputColumns(select.outputColumns());
        List<Expression> groupExprs = select.groupByClause() == null
                ? Collections.emptyList()
                : mapToList(select.groupByClause().expression(), SqlPlanner::parseExpr);
        boolean hasAggregate = false;
        for (Expression e : selectExprs) {
            if (e.find(x -> x instanceof AggregateFunction) != null) {
                hasAggregate = true;
            }
        }
        if (!groupExprs.isEmpty() || hasAggregate) {
            df = planAggregate(df, selectExprs, groupExprs);
        } else {
            df = df.project(selectExprs);
        }

        if (select.limitClause() != null || select.offsetClause() != null) {
            Long limit = select.limitClause() == null ? null : parseLong(select.limitClause().INTEGER_LITERAL().getText());
            long offset = select.offsetClause() == null ? 0 : parseLong(select.offsetClause().INTEGER_LITERAL().getText());
            df = df.limit(limit, offset);
        }
        return df.logicalPlan();
    }

    /**
     * Builds the Aggregate over the distinct group keys and the distinct outermost aggregate calls of the
     * select list, then projects the select list on top of it. In the projection, aggregate calls and
     * sub expressions equal to a group key read the matching Aggregate output column.
     */
    private DataFrame planAggregate(DataFrame input, List<Expression> selectExprs, List<Expression> groupExprs) {
        List<Expression> groups = distinctBy(mapToList(groupExprs, input::resolve), Expression::semanticEquals);
        List<Expression> resolvedSelect = new ArrayList<>();
        for (Expression e : selectExprs) {
            if (e instanceof Star) {
                resolvedSelect.addAll(((Star) e).expand(input.schema()));
            } else {
                resolvedSelect.add(input.resolve(e));
            }
        }
        List<AggregateFunction> aggregates = new ArrayList<>();
        for (Expression e : resolvedSelect) {
            collectAggregates(e, aggregates);
        }
        aggregates = distinctBy(aggregates, Expression::semanticEquals);

        DataFrame aggregated = input.aggregate(groups, aggregates);
        StructType schema = aggregated.schema();
        List<AggregateFunction> finalAggregates = aggregates;
        List<Expression> projectList = mapToList(resolvedSelect, e -> e.transformDown(x -> {
            if (x instanceof AggregateFunction) {
                int idx = indexWhere(finalAggregates, a -> a.semanticEquals(x));
                return AttributeReference.of(schema.get(groups.size() + idx));
            }
            int idx = indexWhere(groups, g -> g.semanticEquals(x));
            return idx >= 0 ? AttributeReference.of(schema.get(idx)) : x;
        }));
        return aggregated.project(projectList);
    }

    private static void collectAggregates(Expression e, List<AggregateFunction> out) {
        if (e instanceof AggregateFunction) {
            out.add((AggregateFunction) e);
            return;
        }
        for (Expression c : e.children()) {
            collectAggregates(c, out);
        }
    }

    private static List<Expression> outputColumns(SimpleSqlParser.OutputColumnsContext outputColumns) {
        if (outputColumns instanceof SimpleSqlParser.StarColumnListContext) {
            return Collections.singletonList(new Star());
        }
        SimpleSqlParser.OutputColumnListContext columnList = (SimpleSqlParser.OutputColumnListContext) outputColumns;
        List<Expression> expressions = new ArrayList<>();
        for (SimpleSqlParser.OutputColumnContext column : columnList.outputColumn()) {
            Expression expr = parseExpr(column.expression());
            if (column.columnAlias() != null) {
                expr = new Alias(expr, identifierText(column.columnAlias().identifier()));
            }
            expressions.add(expr);
        }
        return expressions;
    }

    static Expression parseExpr(ParseTree exprCtx) {
        if (exprCtx instanceof SimpleSqlParser.ParenthesizedExprContext) {
            return parseExpr(((SimpleSqlParser.ParenthesizedExprContext) exprCtx).expression());
        } else if (exprCtx instanceof SimpleSqlParser.LiteralExprContext) {
            return parseLiteral(((SimpleSqlParser.LiteralExprContext) exprCtx).literal());
        } else if (exprCtx instanceof SimpleSqlParser.ColumnExprContext) {
            SimpleSqlParser.ColumnReferenceContext column = ((SimpleSqlParser.ColumnExprContext) exprCtx).columnReference();
            String qualifier = column.tableQualifier == null ? null : identifierText(column.tableQualifier);
            return new UnresolvedAttribute(qualifier, identifierText(column.columnName));
        } else if (exprCtx instanceof SimpleSqlParser.FunctionCallContext) {
            SimpleSqlParser.FunctionCallContext functionCall = (SimpleSqlParser.FunctionCallContext) exprCtx;
            String functionName = identifierText(functionCall.functionName);
            SimpleSqlParser.FunctionArgumentContext argument = functionCall.functionArgument();
            if (argument instanceof SimpleSqlParser.StarArgumentContext) {
                if (!"count".equalsIgnoreCase(functionName)) {
                    throw new SqlParseException(String.format("Function %s does not accept '*'", functionName));
                }
                return Count.star();
            }
            Expression child = parseExpr(((SimpleSqlParser.ExpressionArgumentContext) argument).expression());
            AggregateFunction function = AggregateFunction.create(functionName, child);
            if (function == null) {
                throw new SqlParseException("Unknown function: " + functionName);
            }
            return function;
        } else if (exprCtx instanceof SimpleSqlParser.MultiplicativeExprContext
                || exprCtx instanceof SimpleSqlParser.AdditiveExprContext
                || exprCtx instanceof SimpleSqlParser.ComparisonExprContext
                || exprCtx instanceof SimpleSqlParser.AndExprContext
                || exprCtx instanceof SimpleSqlParser.OrExprContext) {
            ParseTree left = exprCtx.getChild(0);
            ParseTree right = exprCtx.getChild(2);
            String opStr = exprCtx.getChild(1).getText();
            return new BinaryExpression(BinaryOperator.fromSymbol(opStr), parseExpr(left), parseExpr(right));
        }
        throw new SqlParseException(String.format("Unknown expression %s", exprCtx.getText()));
    }

    private static Expression parseLiteral(SimpleSqlParser.LiteralContext literal) {
        String text = literal.getText();
        if (literal instanceof SimpleSqlParser.IntegerLiteralContext) {
            try {
                return new Literal(Value.ofLong(Long.parseLong(text)));
            } catch (NumberFormatException e) {
                // Too large for a bigint.
                return new Literal(Value.ofDouble(Double.parseDouble(text)));
            }
        } else if (literal instanceof SimpleSqlParser.DecimalLiteralContext) {
            return new Literal(Value.ofDouble(Double.parseDouble(text)));
        } else if (literal instanceof SimpleSqlParser.StringLiteralContext) {
            return new Literal(Value.ofString(ExtraStringUtil.unquote(text, '\'')));
        } else if (literal instanceof SimpleSqlParser.BooleanLiteralContext) {
            return new Literal(Value.ofBoolean(((SimpleSqlParser.BooleanLiteralContext) literal).TRUE() != null));
        } else if (literal instanceof SimpleSqlParser.NullLiteralContext) {
            return new Literal(Value.NULL);
        }
        throw new SqlParseException(String.format("Unknown literal %s", text));
    }

    /** Unquoted identifiers are case insensitive and normalized to lower case. */
    private static String identifierText(SimpleSqlParser.IdentifierContext identifier) {
        String text = identifier.getText();
        if (identifier instanceof SimpleSqlParser.QuotedIdentifierContext) {
            return ExtraStringUtil.unquote(text, text.charAt(0));
        }
        return text.toLowerCase(Locale.ROOT);
    }

    private static long parseLong(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new SqlParseException("Invalid number: " + text);
        }
    }

    public static SimpleSqlParser.RootContext parse(String sql) {
        SimpleSqlLexer lexer = new SimpleSqlLexer(CharStreams.fromString(sql));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
        SimpleSqlParser parser = new SimpleSqlParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        return parser.root();
    }

    private static class ThrowingErrorListener extends BaseErrorListener {
        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new SqlParseException(line, charPositionInLine, msg);
        }
    }
}
