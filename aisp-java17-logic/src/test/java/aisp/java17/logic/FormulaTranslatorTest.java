package aisp.java17.logic;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class FormulaTranslatorTest extends LogicTestBase {

    @Test
    void platinumRulesTranslateWithoutFailures() {
        final Translation t = FormulaTranslator.translate(platinum());
        assertThat(t.failures()).isEmpty();
        assertThat(t.rules()).extracting(TranslatedRule::id).containsExactly(
            "Meta#0", "Meta#2", "Rules#0", "Rules#1", "Rules#2", "Rules#3", "Rules#4", "Rules#5", "Rules#6");
    }

    @Test
    void naturalNumbersCarryTheDomainAxiom() {
        final TranslatedRule rule = rule(FormulaTranslator.translate(platinum()), "Rules#0");
        assertThat(Formulas.render(rule.formula())).isEqualTo("∀x:Nat.(x >= 0)");
        assertThat(rule.obligation().assumptionNames()).contains(Axiom.NAT_DOMAIN);
        assertThat(rule.selfReferential()).isFalse();
    }

    @Test
    void enumerationMembershipExpandsToEqualities() {
        final TranslatedRule rule = rule(FormulaTranslator.translate(platinum()), "Rules#1");
        assertThat(Formulas.render(rule.formula())).contains("(p = X)").contains("(p = O)");
        assertThat(rule.citedAxioms()).contains(Axiom.SET_ENUM);
        assertThat(rule.obligation().assumptionNames()).contains("enum-Player", "distinct-Player");
    }

    @Test
    void unionWithEmptySetCitesBothAxioms() {
        final TranslatedRule rule = rule(FormulaTranslator.translate(platinum()), "Rules#5");
        assertThat(rule.citedAxioms()).contains(Axiom.SET_UNION, Axiom.SET_EMPTY, Axiom.SET_ENUM);
    }

    @Test
    void documentQuantifiersAreSelfReferential() {
        final Translation t = FormulaTranslator.translate(platinum());
        assertThat(rule(t, "Meta#0").selfReferential()).isTrue();
        assertThat(rule(t, "Meta#2").selfReferential()).isFalse();
    }

    @Test
    void typeSignaturesAreNotObligations() {
        final Translation t = FormulaTranslator.translate(withRules("f:Index→Index; ∀x:ℕ.x≥0"));
        assertThat(t.rules()).extracting(TranslatedRule::id).containsExactly("Rules#1");
    }

    @Test
    void termsThatAreNotPropositionsAreRecordedAsFailures() {
        final Translation t = FormulaTranslator.translate(withRules("x+1"));
        assertThat(t.rules()).isEmpty();
        assertThat(t.failures()).hasSize(1);
        assertThat(t.failures().get(0).getMessage()).contains("proposition");
    }

    @Test
    void setAxiomsAreAssertedWhenSetsOccur() {
        final List<String> names = FormulaTranslator.translate(platinum()).axioms().stream()
            .map(Axiom::name).collect(Collectors.toList());
        assertThat(names).contains(Axiom.NAT_DOMAIN, Axiom.SET_UNION, Axiom.SET_EMPTY, "enum-Player", "enum-Cell");
        final List<String> plain = FormulaTranslator.translate(withRules("∀x:ℕ.x≥0")).axioms().stream()
            .map(Axiom::name).collect(Collectors.toList());
        assertThat(plain).doesNotContain(Axiom.SET_UNION);
    }

    @Test
    void invariantsAreNotAssumptionsOfTheirOwnStatement() {
        final var document = platinum();
        final List<Invariant> invariants = InvariantDiscovery.discover(document);
        final Translation t = FormulaTranslator.translate(document, invariants);
        final TranslatedRule players = rule(t, "Rules#1");
        final TranslatedRule union = rule(t, "Rules#5");
        final String own = "invariant-type_safety@" + players.byteOffset();
        assertThat(players.obligation().assumptionNames()).doesNotContain(own);
        assertThat(union.obligation().assumptionNames()).contains(own);
    }

    static TranslatedRule rule(Translation t, String id) {
        return t.rules().stream().filter(r -> r.id().equals(id)).findFirst().orElseThrow();
    }
}
