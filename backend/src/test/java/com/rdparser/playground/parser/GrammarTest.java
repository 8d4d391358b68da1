package com.rdparser.playground.parser;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class GrammarTest {

    @Test void listsFiveProductionsInOrder() {
        assertEquals(List.of("E", "E'", "T", "T'", "F"),
                Grammar.productions().stream().map(Production::lhs).toList());
    }

    @Test void ruleMatchingDistinguishesPrimes() {
        Production e = Grammar.productions().get(0);
        Production ePrime = Grammar.productions().get(1);

        assertTrue(e.matchesRule("E → T E'"));
        assertFalse(e.matchesRule("E' → ε"));
        assertTrue(ePrime.matchesRule("E' → + T E'"));
        assertFalse(e.matchesRule("✓ Parse Complete"));
        assertFalse(e.matchesRule(null));
    }

    @Test void everyProductionStepMapsToAProduction() {
        List<Step> steps = Parser.parse(Tokenizer.tokenize("(a+1)*b/2-c").tokens()).steps();

        for (Step step : steps.subList(0, steps.size() - 1)) {
            assertTrue(Grammar.productionFor(step).isPresent(), step.rule());
        }
        assertTrue(Grammar.productionFor(steps.get(steps.size() - 1)).isEmpty());
    }
}
