package com.questrail.simmonitor.internal.predicate;

import com.questrail.simmonitor.ast.BinaryExpression;
import com.questrail.simmonitor.ast.FieldAccess;
import com.questrail.simmonitor.ast.Literal;
import com.questrail.simmonitor.ast.PredicateExpression;
import com.questrail.simmonitor.ast.VacuousTruth;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PredicateCompiler
 * =============================================================================
 * Compiles a {@link PredicateExpression} into a {@link MessagePredicate}.
 *
 * <h2>Supported shapes</h2>
 * <ul>
 *   <li>{@code field OP literal} and {@code literal OP field} for
 *       {@code =, !=, <, <=, >, >=} (the second form is mirrored)</li>
 *   <li>{@code A and B}: both sides are evaluated, then conjoined</li>
 *   <li>{@code A implies B} (alias {@code iff}): {@code B} is consulted only when
 *       {@code A} holds; otherwise the result is {@code false}</li>
 *   <li>{@link VacuousTruth}: always {@code true}</li>
 * </ul>
 *
 * <h2>Literals</h2>
 * Numbers compare numerically regardless of their boxed type, so a message
 * field decoded as {@code Integer 5} equals literal {@code 5.0}. String
 * literals arrive with their quote markers, which are stripped here; an
 * unquoted string literal is rejected.
 *
 * <p>Compilation happens once, before the run; everything that can be
 * rejected statically is rejected here with {@link PredicateCompileException}.</p>
 */
public final class PredicateCompiler
{
    public MessagePredicate compile(PredicateExpression expression) {
        Objects.requireNonNull(expression, "expression");

        if (expression instanceof VacuousTruth) {
            return MessagePredicate.ALWAYS;
        }
        if (expression instanceof BinaryExpression) {
            return compileBinary((BinaryExpression) expression);
        }
        throw new PredicateCompileException("Expression is not a predicate: " + expression);
    }

    private MessagePredicate compileBinary(BinaryExpression expression) {
        Operator operator = Operator.fromSymbol(expression.operator())
                .orElseThrow(() -> new PredicateCompileException(
                        "Unsupported operator \"" + expression.operator() + "\""));

        if (!operator.isRelational()) {
            MessagePredicate left = compile(expression.left());
            MessagePredicate right = compile(expression.right());
            if (operator == Operator.AND) {
                return message -> {
                    boolean l = left.test(message);
                    boolean r = right.test(message);
                    return l && r;
                };
            }
            return message -> left.test(message) ? right.test(message) : false;
        }

        PredicateExpression fieldSide = expression.left();
        PredicateExpression literalSide = expression.right();
        if (fieldSide instanceof Literal && literalSide instanceof FieldAccess) {
            fieldSide = expression.right();
            literalSide = expression.left();
            operator = operator.mirrored();
        }
        if (!(fieldSide instanceof FieldAccess) || !(literalSide instanceof Literal)) {
            throw new PredicateCompileException(
                    "Comparison \"" + expression.operator() + "\" requires a field and a literal");
        }

        List<String> path = ((FieldAccess) fieldSide).path();
        Object expected = literalValue((Literal) literalSide);
        return comparison(operator, path, expected);
    }

    private static MessagePredicate comparison(Operator operator, List<String> path, Object expected) {
        switch (operator) {
            case EQUAL:
                return message -> valuesEqual(resolve(message, path), expected);
            case DIFFERENT:
                return message -> !valuesEqual(resolve(message, path), expected);
            case LESSER:
                return message -> order(resolve(message, path), expected, path) < 0;
            case LESSER_OR_EQUAL:
                return message -> order(resolve(message, path), expected, path) <= 0;
            case GREATER:
                return message -> order(resolve(message, path), expected, path) > 0;
            case GREATER_OR_EQUAL:
                return message -> order(resolve(message, path), expected, path) >= 0;
            default:
                throw new PredicateCompileException("Not a comparison: " + operator);
        }
    }

    static Object literalValue(Literal literal) {
        Object value = literal.value();
        if (!(value instanceof String)) {
            return value;
        }
        String token = (String) value;
        if (token.length() >= 2) {
            char first = token.charAt(0);
            char last = token.charAt(token.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return token.substring(1, token.length() - 1);
            }
        }
        throw new PredicateCompileException("String literal is not quoted: " + token);
    }

    /**
     * Walks {@code path} through nested maps. Fails fast on any missing key.
     */
    static Object resolve(Map<String, Object> message, List<String> path) {
        Object current = message;
        for (String key : path) {
            if (!(current instanceof Map)) {
                throw new FieldResolutionException(path, key);
            }
            Map<?, ?> node = (Map<?, ?>) current;
            if (!node.containsKey(key)) {
                throw new FieldResolutionException(path, key);
            }
            current = node.get(key);
        }
        return current;
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return compareNumbers((Number) actual, (Number) expected) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static int order(Object actual, Object expected, List<String> path) {
        if (actual instanceof Number && expected instanceof Number) {
            return compareNumbers((Number) actual, (Number) expected);
        }
        if (actual instanceof String && expected instanceof String) {
            return ((String) actual).compareTo((String) expected);
        }
        if (actual instanceof Boolean && expected instanceof Boolean) {
            return Boolean.compare((Boolean) actual, (Boolean) expected);
        }
        throw new PredicateEvaluationException("Cannot order field '" + String.join(".", path)
                + "' value " + describe(actual) + " against " + describe(expected));
    }

    private static int compareNumbers(Number a, Number b) {
        BigDecimal x = exact(a);
        BigDecimal y = exact(b);
        if (x == null || y == null) {
            // NaN or infinity on one side
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return x.compareTo(y);
    }

    private static BigDecimal exact(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private static String describe(Object value) {
        return value == null ? "null" : value + " (" + value.getClass().getSimpleName() + ")";
    }
}
