package aisp.java17.logic;

import java.util.Objects;

/// Result of trying to prove a formula valid.
public sealed interface Verdict permits Verdict.Proven, Verdict.Disproven, Verdict.Unknown {

    TruthValue truth();

    default boolean isDefinite() {
        return truth() != TruthValue.UNKNOWN;
    }

    record Proven(ProofObject proof) implements Verdict {
        public Proven {
            Objects.requireNonNull(proof, "proof must not be null");
        }

        @Override
        public TruthValue truth() {
            return TruthValue.TRUE;
        }
    }

    /// The formula is not valid. `counterexample` describes a falsifying model.
    record Disproven(String counterexample, ProofObject proof) implements Verdict {
        public Disproven {
            Objects.requireNonNull(counterexample, "counterexample must not be null");
            Objects.requireNonNull(proof, "proof must not be null");
        }

        @Override
        public TruthValue truth() {
            return TruthValue.FALSE;
        }
    }

    record Unknown(UnknownReason reason, String detail) implements Verdict {
        public Unknown {
            Objects.requireNonNull(reason, "reason must not be null");
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public TruthValue truth() {
            return TruthValue.UNKNOWN;
        }
    }

    static Unknown unknown(UnknownReason reason, String detail) {
        return new Unknown(reason, detail);
    }
}
