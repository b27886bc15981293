package de.bsommerfeld.g11n.core.plural;

import org.junit.jupiter.api.Test;

import java.util.List;

import static de.bsommerfeld.g11n.core.plural.PluralForm.*;
import static org.junit.jupiter.api.Assertions.*;

class PluralRulesTest {

    @Test
    void english_shouldDistinguishOneAndOther() {
        assertEquals(OTHER, PluralRules.select("en", 0, false));
        assertEquals(ONE, PluralRules.select("en", 1, false));
        assertEquals(OTHER, PluralRules.select("en", 2, false));
        assertEquals(OTHER, PluralRules.select("en", 101, false));
    }

    @Test
    void english_shouldSelectOrdinalSuffixes() {
        assertEquals(ONE, PluralRules.select("en", 1, true));
        assertEquals(TWO, PluralRules.select("en", 2, true));
        assertEquals(FEW, PluralRules.select("en", 3, true));
        assertEquals(OTHER, PluralRules.select("en", 4, true));
        assertEquals(OTHER, PluralRules.select("en", 11, true));
        assertEquals(OTHER, PluralRules.select("en", 12, true));
        assertEquals(OTHER, PluralRules.select("en", 13, true));
        assertEquals(ONE, PluralRules.select("en", 21, true));
        assertEquals(TWO, PluralRules.select("en", 22, true));
        assertEquals(FEW, PluralRules.select("en", 23, true));
        assertEquals(OTHER, PluralRules.select("en", 111, true));
    }

    @Test
    void spanish_shouldUseOtherForAllOrdinals() {
        assertEquals(ONE, PluralRules.select("es", 1, false));
        assertEquals(OTHER, PluralRules.select("es", 0, false));
        assertEquals(OTHER, PluralRules.select("es", 1, true));
    }

    @Test
    void french_shouldTreatZeroAsSingular() {
        assertEquals(ONE, PluralRules.select("fr", 0, false));
        assertEquals(ONE, PluralRules.select("fr", 1, false));
        assertEquals(OTHER, PluralRules.select("fr", 2, false));
        assertEquals(ONE, PluralRules.select("fr", 1, true));
        assertEquals(OTHER, PluralRules.select("fr", 2, true));
    }

    @Test
    void arabic_shouldSelectAllSixCategories() {
        assertEquals(ZERO, PluralRules.select("ar", 0, false));
        assertEquals(ONE, PluralRules.select("ar", 1, false));
        assertEquals(TWO, PluralRules.select("ar", 2, false));
        assertEquals(FEW, PluralRules.select("ar", 3, false));
        assertEquals(FEW, PluralRules.select("ar", 10, false));
        assertEquals(MANY, PluralRules.select("ar", 11, false));
        assertEquals(MANY, PluralRules.select("ar", 99, false));
        assertEquals(OTHER, PluralRules.select("ar", 100, false));
        assertEquals(OTHER, PluralRules.select("ar", 102, false));
        assertEquals(FEW, PluralRules.select("ar", 103, false));
        assertEquals(OTHER, PluralRules.select("ar", 5, true));
    }

    @Test
    void select_shouldTreatFractionsAsOther() {
        assertEquals(OTHER, PluralRules.select("en", 1.5, false));
        assertEquals(ONE, PluralRules.select("en", 1.0, false));
        assertEquals(OTHER, PluralRules.select("en", 21.5, true));
        assertEquals(OTHER, PluralRules.select("fr", 0.5, false));
        assertEquals(OTHER, PluralRules.select("ar", 3.5, false));
        assertEquals(OTHER, PluralRules.select("ar", 11.25, false));
    }

    @Test
    void forLocale_shouldUseFamilyOfRegionalTags() {
        assertSame(PluralRules.FRENCH, PluralRules.forLocale("fr-CA"));
        assertSame(PluralRules.ARABIC, PluralRules.forLocale("ar_EG"));
    }

    @Test
    void forLocale_shouldDefaultToEnglish() {
        assertSame(PluralRules.ENGLISH, PluralRules.forLocale("de"));
        assertSame(PluralRules.ENGLISH, PluralRules.forLocale(null));
        assertFalse(PluralRules.hasRule("de"));
    }

    @Test
    void getPluralForms_shouldListFormsInFirstSeenOrder() {
        assertEquals(List.of(ZERO, ONE, TWO, FEW, MANY, OTHER), PluralRules.getPluralForms("ar", false));
        assertEquals(List.of(OTHER, ONE), PluralRules.getPluralForms("en", false));
        assertEquals(List.of(OTHER, ONE, TWO, FEW), PluralRules.getPluralForms("en", true));
        assertEquals(List.of(OTHER), PluralRules.getPluralForms("es", true));
    }

    @Test
    void hasPluralForm_shouldReflectRule() {
        assertTrue(PluralRules.hasPluralForm("ar", MANY, false));
        assertFalse(PluralRules.hasPluralForm("en", ZERO, false));
        assertTrue(PluralRules.hasPluralForm("en", FEW, true));
    }

    @Test
    void register_shouldAddRuleForNewFamily() {
        PluralRules.register("zz-ZZ", (count, ordinal) -> count == 0 ? ZERO : MANY);

        assertTrue(PluralRules.hasRule("zz"));
        assertEquals(ZERO, PluralRules.select("zz", 0, false));
        assertEquals(MANY, PluralRules.select("zz_XX", 7, false));
    }

    @Test
    void register_shouldRejectEmptyFamily() {
        assertThrows(IllegalArgumentException.class, () -> PluralRules.register("", PluralRules.ENGLISH));
    }

    @Test
    void pluralForm_shouldRoundTripBundleKeys() {
        assertEquals("few", FEW.key());
        assertEquals(MANY, PluralForm.fromKey("many"));
        assertNull(PluralForm.fromKey("several"));
    }
}
