/**
 * Translation bundles and their in-memory cache.
 *
 * <h2>Data flow</h2>
 *
 * <pre>
 *   BundleLoader            ← async source (classpath, disk, HTTP, ...)
 *        │ Map tree
 *        ▼
 *   TranslationStore        ← dedup of in-flight loads, failure → empty bundle
 *        │ Bundle (immutable)
 *        ▼
 *   getTranslation / lookup ← string leaf or classified BundleEntry
 * </pre>
 *
 * <h2>Bundle documents</h2>
 * One JSON object per (locale, namespace). Leaves are strings; objects nest
 * keys and are addressed with dot paths. An object whose children are all
 * strings is a set of plural forms:
 *
 * <pre>
 * "items": { "0": "No items", "one": "{{count}} item", "other": "{{count}} items" }
 * </pre>
 *
 * Keys such as {@code "0"}, {@code "2-5"} or {@code "10+"} override the CLDR
 * category for exact counts and inclusive intervals. One further level of flat
 * objects adds grammatical contexts:
 *
 * <pre>
 * "friend": { "one": "a friend", "other": "{{count}} friends",
 *             "male": { "one": "a boyfriend", "other": "{{count}} boyfriends" } }
 * </pre>
 */
package de.bsommerfeld.g11n.core.bundle;
