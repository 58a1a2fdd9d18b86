package aisp.java17.logic;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/// Term of the logical formula IR.
public sealed interface Term permits Term.Var, Term.Constant, Term.Numeral, Term.Apply {

    enum Kind { VAR, CONSTANT, NUMERAL, APPLY }

    Kind kind();

    Sort sort();

    /// Bound or free variable.
    record Var(String name, Sort sort) implements Term {
        public Var {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(sort, "sort must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.VAR;
        }
    }

    /// Named constant: enumeration members, declared objects and Skolem constants.
    record Constant(String name, Sort sort) implements Term {
        public Constant {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(sort, "sort must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }
    }

    record Numeral(BigDecimal value) implements Term {
        public Numeral {
            Objects.requireNonNull(value, "value must not be null");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        public static Numeral of(long value) {
            return new Numeral(BigDecimal.valueOf(value));
        }

        @Override
        public Kind kind() {
            return Kind.NUMERAL;
        }

        @Override
        public Sort sort() {
            return value.scale() <= 0 ? (value.signum() >= 0 ? Sort.NAT : Sort.INT) : Sort.REAL;
        }
    }

    /// Function application. Arithmetic (`+ - * /`) and set functions (`union`, `inter`, `diff`)
    /// are interpreted; other names are uninterpreted functions.
    record Apply(String function, List<Term> args, Sort sort) implements Term {
        public Apply {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(args, "args must not be null");
            Objects.requireNonNull(sort, "sort must not be null");
            args = List.copyOf(args); // defensive copy
        }

        @Override
        public Kind kind() {
            return Kind.APPLY;
        }

        public boolean isArithmetic() {
            return switch (function) {
                case "+", "-", "*", "/", "neg" -> true;
                default -> false;
            };
        }
    }
}
