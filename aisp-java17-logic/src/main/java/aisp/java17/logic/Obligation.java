package aisp.java17.logic;

import aisp.java17.parser.Sha256;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A validity question: do the `assumptions` entail `goal`?
///
/// The cache key hashes the canonical rendering of the goal and of every assumption, so two
/// obligations with the same content share cached verdicts regardless of their ids.
public record Obligation(String id, Formula goal, List<Axiom> assumptions) {
    public Obligation {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(goal, "goal must not be null");
        Objects.requireNonNull(assumptions, "assumptions must not be null");
        assumptions = List.copyOf(assumptions); // defensive copy
    }

    public static Obligation of(String id, Formula goal) {
        return new Obligation(id, goal, List.of());
    }

    public String cacheKey() {
        final var sb = new StringBuilder(Formulas.render(goal));
        final var rendered = new ArrayList<String>();
        assumptions.forEach(a -> rendered.add(a.name() + "=" + Formulas.render(a.formula())));
        rendered.sort(null);
        rendered.forEach(r -> sb.append('\n').append(r));
        return Sha256.hex(sb.toString());
    }

    public List<String> assumptionNames() {
        final var names = new ArrayList<String>(assumptions.size());
        assumptions.forEach(a -> names.add(a.name()));
        return names;
    }

    public Obligation withGoal(Formula newGoal) {
        return new Obligation(id, newGoal, assumptions);
    }

    public Obligation withAssumptions(List<Axiom> newAssumptions) {
        return new Obligation(id, goal, newAssumptions);
    }
}
