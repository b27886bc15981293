package de.bsommerfeld.g11n.core.plural;

import de.bsommerfeld.g11n.core.bundle.BundleEntry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PluralizerTest {

    private final Pluralizer pluralizer = new Pluralizer();

    private static BundleEntry.Forms forms(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return new BundleEntry.Forms(map);
    }

    @Test
    void pluralize_shouldSelectCldrForm() {
        var items = forms("one", "one item", "other", "many items");

        assertEquals("one item", pluralizer.pluralize("en", 1, items, false, null));
        assertEquals("many items", pluralizer.pluralize("en", 0, items, false, null));
        assertEquals("many items", pluralizer.pluralize("en", 5, items, false, null));
    }

    @Test
    void pluralize_shouldUseOtherFormForFractionalCount() {
        var items = forms("one", "one item", "other", "many items");

        assertEquals("many items", pluralizer.pluralize("en", 1.5, items, false, null));
    }

    @Test
    void pluralize_shouldMatchExactKeyOfFractionalCount() {
        var items = forms("1.5", "one and a half", "2", "a pair", "other", "some");

        assertEquals("one and a half", pluralizer.pluralize("en", 1.5, items, false, null));
        assertEquals("a pair", pluralizer.pluralize("en", 2.0, items, false, null));
        assertEquals("some", pluralizer.pluralize("en", 2.5, items, false, null));
    }

    @Test
    void pluralize_shouldFallBackToFractionalCountText() {
        assertEquals("2.5", pluralizer.pluralize("en", 2.5, forms("one", "one"), false, null));
    }

    @Test
    void pluralize_shouldPreferExactCountKey() {
        var items = forms("0", "no items", "one", "one item", "other", "items");

        assertEquals("no items", pluralizer.pluralize("en", 0, items, false, null));
    }

    @Test
    void pluralize_shouldPreferExactKeyOverInterval() {
        var items = forms("2-5", "a few", "3", "exactly three", "other", "items");

        assertEquals("exactly three", pluralizer.pluralize("en", 3, items, false, null));
        assertEquals("a few", pluralizer.pluralize("en", 4, items, false, null));
    }

    @Test
    void pluralize_shouldUseFirstMatchingIntervalInDocumentOrder() {
        var items = forms("2-5", "a few", "5+", "plenty", "other", "items");

        assertEquals("a few", pluralizer.pluralize("en", 5, items, false, null));
        assertEquals("plenty", pluralizer.pluralize("en", 6, items, false, null));
        assertEquals("items", pluralizer.pluralize("en", 1, items, false, null));
    }

    @Test
    void pluralize_shouldIgnoreMalformedIntervalKeys() {
        var items = forms("5-", "broken", "+5", "broken", "other", "items");

        assertEquals("items", pluralizer.pluralize("en", 5, items, false, null));
    }

    @Test
    void pluralize_shouldFallBackToOtherForm() {
        var items = forms("other", "{{count}} things");

        assertEquals("{{count}} things", pluralizer.pluralize("en", 1, items, false, null));
    }

    @Test
    void pluralize_shouldReturnCountWhenNoFormMatches() {
        var items = forms("one", "one item");

        assertEquals("5", pluralizer.pluralize("en", 5, items, false, null));
    }

    @Test
    void pluralize_shouldSelectOrdinalForms() {
        var place = forms("one", "{{count}}st", "two", "{{count}}nd", "few", "{{count}}rd", "other", "{{count}}th");

        assertEquals("{{count}}nd", pluralizer.pluralize("en", 22, place, true, null));
        assertEquals("{{count}}th", pluralizer.pluralize("en", 12, place, true, null));
    }

    @Test
    void pluralize_shouldUseLocaleRules() {
        var items = forms("zero", "none", "one", "one", "two", "two", "few", "few", "many", "many", "other", "other");

        assertEquals("none", pluralizer.pluralize("ar", 0, items, false, null));
        assertEquals("many", pluralizer.pluralize("ar", 11, items, false, null));
        assertEquals("one", pluralizer.pluralize("fr", 0, items, false, null));
    }

    @Test
    void pluralize_shouldResolveGrammaticalContext() {
        var friend = new BundleEntry.Context(
                Map.of("one", "a friend", "other", "{{count}} friends"),
                Map.of("male", forms("one", "a boyfriend", "other", "{{count}} boyfriends")));

        assertEquals("a boyfriend", pluralizer.pluralize("en", 1, friend, false, "male"));
        assertEquals("{{count}} boyfriends", pluralizer.pluralize("en", 3, friend, false, "male"));
        assertEquals("a friend", pluralizer.pluralize("en", 1, friend, false, "female"));
        assertEquals("a friend", pluralizer.pluralize("en", 1, friend, false, null));
    }

    @Test
    void pluralize_shouldContinueWithOuterFormsWhenContextLacksForm() {
        var friend = new BundleEntry.Context(
                Map.of("one", "a friend", "other", "{{count}} friends"),
                Map.of("male", forms("one", "a boyfriend")));

        assertEquals("{{count}} friends", pluralizer.pluralize("en", 4, friend, false, "male"));
    }

    @Test
    void pluralize_shouldReturnTextEntryAsIs() {
        assertEquals("fixed", pluralizer.pluralize("en", 4, new BundleEntry.Text("fixed"), false, null));
    }

    @Test
    void pluralize_shouldAcceptPlainMaps() {
        assertEquals("one", pluralizer.pluralize("en", 1, Map.of("one", "one", "other", "other"), false));
    }

    @Test
    void getPluralForm_shouldExposeRule() {
        assertEquals(PluralForm.FEW, pluralizer.getPluralForm("en", 23, true));
    }
}
