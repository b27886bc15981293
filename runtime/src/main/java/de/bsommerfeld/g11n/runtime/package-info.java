/**
 * Wiring and lifecycle: the Guice module, configuration loading and the
 * {@link de.bsommerfeld.g11n.runtime.G11n} facade.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Application]
 *        │
 *        ▼
 *   G11n / StandaloneG11n   ← init, t(), changeLocale()
 *    ┌───┴──────────┐
 *    │              │
 * LocaleManager  Translator ── Pluralizer, Interpolator
 *    │              │
 *    │        TranslationStore ── BundleLoader
 *    ▼
 * LocalePersistence       ← file in PROD, in-memory in TEST
 * </pre>
 */
package de.bsommerfeld.g11n.runtime;
