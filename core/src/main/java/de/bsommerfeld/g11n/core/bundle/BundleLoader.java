package de.bsommerfeld.g11n.core.bundle;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches the key tree for one (locale, namespace) pair from wherever
 * bundles live.
 *
 * <p>
 * Implementations must not fail: transport errors, missing documents and
 * parse errors all resolve to an empty map. Any timeout also belongs here;
 * the cache waits for as long as the returned future takes.
 */
@FunctionalInterface
public interface BundleLoader {

    CompletableFuture<Map<String, Object>> load(String locale, String namespace);
}
