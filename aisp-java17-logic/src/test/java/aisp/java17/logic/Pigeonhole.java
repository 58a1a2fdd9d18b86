package aisp.java17.logic;

import aisp.java17.logic.Formula.Atom;
import aisp.java17.logic.Formula.Not;

import java.util.ArrayList;

/// Pigeonhole formulas: `n` pigeons never fit into `m < n` holes one by one.
final class Pigeonhole {
    private Pigeonhole() {}

    static Obligation obligation(int pigeons, int holes) {
        final var parts = new ArrayList<Formula>();
        for (int i = 0; i < pigeons; i++) {
            final var somewhere = new ArrayList<Formula>();
            for (int j = 0; j < holes; j++) {
                somewhere.add(in(i, j));
            }
            parts.add(Formula.or(somewhere));
        }
        for (int j = 0; j < holes; j++) {
            for (int i = 0; i < pigeons; i++) {
                for (int k = i + 1; k < pigeons; k++) {
                    parts.add(new Not(Formula.and(in(i, j), in(k, j))));
                }
            }
        }
        return Obligation.of("php-" + pigeons + "-" + holes, new Not(Formula.and(parts)));
    }

    private static Formula in(int pigeon, int hole) {
        return Atom.of("p_" + pigeon + "_" + hole);
    }
}
