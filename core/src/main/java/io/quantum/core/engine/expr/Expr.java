package io.quantum.core.engine.expr;

import io.quantum.core.spi.EvaluationScope;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled expression tree. Nodes are immutable and hold no evaluation state, so one tree is
 * evaluated concurrently against many scopes.
 */
interface Expr {

    Object eval(EvaluationScope scope);

    record Literal(Object value) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            return value;
        }
    }

    /** A dotted identifier chain such as {@code session.user.name}, resolved by the scope. */
    record Path(String path) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            return Values.canonical(scope.lookup(path));
        }
    }

    record Member(Expr target, String name) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            return Values.member(target.eval(scope), name);
        }
    }

    record Index(Expr target, Expr key) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            return Values.index(target.eval(scope), key.eval(scope));
        }
    }

    record ArrayLiteral(List<Expr> items) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            List<Object> values = new ArrayList<>(items.size());
            for (Expr item : items) {
                values.add(item.eval(scope));
            }
            return values;
        }
    }

    record ObjectLiteral(List<String> keys, List<Expr> values) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                map.put(keys.get(i), values.get(i).eval(scope));
            }
            return map;
        }
    }

    record Negate(Expr operand) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            return Values.arithmetic('-', 0L, operand.eval(scope));
        }
    }

    record Not(Expr operand) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            return !Values.isTruthy(operand.eval(scope));
        }
    }

    record Binary(TokenType op, Expr left, Expr right) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            Object l = left.eval(scope);
            Object r = right.eval(scope);
            return switch (op) {
                case PLUS -> Values.plus(l, r);
                case MINUS -> Values.arithmetic('-', l, r);
                case STAR -> Values.arithmetic('*', l, r);
                case SLASH -> Values.arithmetic('/', l, r);
                case PERCENT -> Values.arithmetic('%', l, r);
                case EQ_EQ -> Values.looseEquals(l, r);
                case NOT_EQ -> !Values.looseEquals(l, r);
                case LT -> Values.compare(l, r) < 0;
                case LT_EQ -> Values.compare(l, r) <= 0;
                case GT -> Values.compare(l, r) > 0;
                case GT_EQ -> Values.compare(l, r) >= 0;
                default -> throw new IllegalStateException("not a binary operator: " + op);
            };
        }
    }

    /** {@code and}/{@code or}: short-circuit, yielding the deciding operand. */
    record Logical(boolean and, Expr left, Expr right) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            Object l = left.eval(scope);
            boolean truthy = Values.isTruthy(l);
            if (and ? !truthy : truthy) {
                return l;
            }
            return right.eval(scope);
        }
    }

    record Ternary(Expr condition, Expr whenTrue, Expr whenFalse) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            return Values.isTruthy(condition.eval(scope)) ? whenTrue.eval(scope) : whenFalse.eval(scope);
        }
    }

    /** A call to a user function (preferred when one is visible) or a built-in. */
    record Call(String name, List<Expr> arguments) implements Expr {
        @Override
        public Object eval(EvaluationScope scope) {
            List<Object> args = new ArrayList<>(arguments.size());
            for (Expr argument : arguments) {
                args.add(argument.eval(scope));
            }
            if (scope.hasFunction(name)) {
                return Values.canonical(scope.invokeFunction(name, args));
            }
            Builtins.Builtin builtin = Builtins.get(name);
            if (builtin == null) {
                throw new UnknownFunctionException(name);
            }
            return builtin.apply(args, scope);
        }
    }

    /** Raised for a call to a name that is neither a user function nor a built-in. */
    final class UnknownFunctionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        UnknownFunctionException(String name) {
            super("unknown function '" + name + "'");
        }
    }
}
