package aisp.java17.logic;

import aisp.java17.parser.BlockTag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InvariantDiscoveryTest extends LogicTestBase {

    private static Invariant structural(List<Invariant> invariants, BlockTag tag) {
        return invariants.stream()
            .filter(i -> i.kind() == Invariant.Kind.STRUCTURAL && i.block() == tag)
            .findFirst()
            .orElseThrow();
    }

    @Test
    void independentCuesCombine() {
        assertThat(InvariantDiscovery.confidence(List.of())).isZero();
        assertThat(InvariantDiscovery.confidence(List.of(0.6))).isCloseTo(0.6, within(1e-9));
        assertThat(InvariantDiscovery.confidence(List.of(0.6, 0.2))).isCloseTo(0.68, within(1e-9));
        assertThat(InvariantDiscovery.confidence(List.of(1.0, 0.5))).isEqualTo(1.0);
    }

    @Test
    void enumerationsBecomeMembershipAssumptions() {
        final List<Invariant> invariants = InvariantDiscovery.discover(platinum());
        final Invariant player = invariants.stream()
            .filter(i -> i.description().startsWith("every Player is one of"))
            .findFirst()
            .orElseThrow();
        assertThat(player.kind()).isEqualTo(Invariant.Kind.MEMBERSHIP);
        assertThat(player.confidence()).isCloseTo(0.6, within(1e-9));
        assertThat(player.assumption()).isPresent();
        assertThat(player.block()).isEqualTo(BlockTag.TYPES);
    }

    @Test
    void repeatedQuantifierDomainRaisesConfidence() {
        final List<Invariant> invariants = InvariantDiscovery.discover(platinum());
        assertThat(invariants)
            .filteredOn(i -> i.kind() == Invariant.Kind.TYPE_SAFETY && i.description().endsWith(":Index"))
            .isNotEmpty()
            .allSatisfy(i -> assertThat(i.confidence()).isCloseTo(0.6, within(1e-9)));
    }

    @Test
    void rangeChecksAreBounds() {
        final List<Invariant> invariants = InvariantDiscovery.discover(platinum());
        assertThat(invariants)
            .filteredOn(i -> i.kind() == Invariant.Kind.BOUNDS)
            .extracting(Invariant::block)
            .contains(BlockTag.RULES, BlockTag.FUNCTIONS);
    }

    @Test
    void structuralChecksPerBlock() {
        final List<Invariant> invariants = InvariantDiscovery.discover(platinum());
        final Invariant rules = structural(invariants, BlockTag.RULES);
        assertThat(rules.description()).contains("names unique", "references resolve", "non-empty");
        assertThat(rules.confidence()).isCloseTo(0.973, within(1e-9));
        assertThat(rules.assumption()).isEmpty();

        final Invariant funcs = structural(invariants, BlockTag.FUNCTIONS);
        assertThat(funcs.description()).contains("unresolved").contains("Other").contains("Place");
        assertThat(funcs.confidence()).isCloseTo(0.91, within(1e-9));
    }

    @Test
    void unlabelledBlocksAreNamedByTag() {
        final List<Invariant> invariants = InvariantDiscovery.discover(platinum());
        assertThat(structural(invariants, BlockTag.EVIDENCE).description()).startsWith("Evidence: ");
        assertThat(structural(invariants, BlockTag.RULES).description()).startsWith("Rules: ");
    }

    @Test
    void confidenceStaysInRange() {
        assertThat(InvariantDiscovery.discover(platinum()))
            .allSatisfy(i -> assertThat(i.confidence()).isBetween(0.0, 1.0));
    }
}
