package de.bsommerfeld.g11n.core.bundle;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.g11n.core.event.G11nEventBus;
import de.bsommerfeld.g11n.core.event.G11nEvents.NamespaceLoadedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests load deduplication, the failure policy, invalidation and the
 * missing-key ledger. The loader is mocked so completion can be controlled.
 */
@ExtendWith(MockitoExtension.class)
class TranslationStoreTest {

    private static final Map<String, Object> COMMON = Map.of(
            "app", Map.of("title", "Inventory"),
            "items", Map.of("one", "{{count}} item", "other", "{{count}} items"));

    @Mock
    private BundleLoader loader;

    private G11nEventBus eventBus;
    private TranslationStore store;

    @BeforeEach
    void setUp() {
        eventBus = new G11nEventBus();
        store = new TranslationStore(loader, eventBus);
    }

    // -- Loading --

    @Test
    void loadNamespace_shouldCacheLoadedBundle() throws Exception {
        when(loader.load("en", "common")).thenReturn(CompletableFuture.completedFuture(COMMON));

        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);

        assertTrue(store.hasNamespace("en", "common"));
        assertEquals("Inventory", store.getTranslation("en", "common", "app.title"));
    }

    @Test
    void loadNamespace_shouldInvokeLoaderOnceForConcurrentCallers() throws Exception {
        var pending = new CompletableFuture<Map<String, Object>>();
        when(loader.load("en", "common")).thenReturn(pending);

        CompletableFuture<Void> first = store.loadNamespace("en", "common");
        CompletableFuture<Void> second = store.loadNamespace("en", "common");

        assertSame(first, second);
        assertTrue(store.isLoading("en", "common"));
        assertFalse(first.isDone());

        pending.complete(COMMON);
        first.get(1, TimeUnit.SECONDS);

        verify(loader, times(1)).load("en", "common");
        assertFalse(store.isLoading("en", "common"));
    }

    @Test
    void loadNamespace_shouldNotReloadCachedNamespace() throws Exception {
        when(loader.load("en", "common")).thenReturn(CompletableFuture.completedFuture(COMMON));

        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);
        CompletableFuture<Void> again = store.loadNamespace("en", "common");

        assertTrue(again.isDone());
        verify(loader, times(1)).load("en", "common");
    }

    @Test
    void loadNamespace_shouldCacheEmptyBundleWhenLoaderFails() throws Exception {
        when(loader.load("en", "common"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("network down")));

        CompletableFuture<Void> load = store.loadNamespace("en", "common");

        assertDoesNotThrow(() -> load.get(1, TimeUnit.SECONDS));
        assertTrue(store.hasNamespace("en", "common"));
        assertTrue(store.getBundle("en", "common").isEmpty());

        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);
        verify(loader, times(1)).load("en", "common");
    }

    @Test
    void loadNamespace_shouldCacheEmptyBundleWhenLoaderThrows() throws Exception {
        when(loader.load("en", "common")).thenThrow(new IllegalStateException("broken loader"));

        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);

        assertTrue(store.hasNamespace("en", "common"));
        assertNull(store.getTranslation("en", "common", "app.title"));
    }

    @Test
    void loadNamespace_shouldPostNamespaceLoadedEvent() throws Exception {
        when(loader.load("en", "common")).thenReturn(CompletableFuture.completedFuture(COMMON));
        List<NamespaceLoadedEvent> events = new ArrayList<>();
        eventBus.register(new Object() {
            @Subscribe
            public void onLoaded(NamespaceLoadedEvent event) {
                events.add(event);
            }
        });

        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);

        assertEquals(List.of(new NamespaceLoadedEvent("en", "common", false)), events);
    }

    @Test
    void preloadLocale_shouldLoadAllNamespacesDespiteSiblingFailure() throws Exception {
        when(loader.load("en", "common")).thenReturn(CompletableFuture.completedFuture(COMMON));
        when(loader.load("en", "admin"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("missing")));

        store.preloadLocale("en", List.of("common", "admin")).get(1, TimeUnit.SECONDS);

        assertTrue(store.hasNamespace("en", "common"));
        assertTrue(store.hasNamespace("en", "admin"));
        assertFalse(store.getBundle("en", "common").isEmpty());
    }

    // -- Invalidation --

    @Test
    void clearLocaleCache_shouldDiscardResultOfInFlightLoad() throws Exception {
        var pending = new CompletableFuture<Map<String, Object>>();
        when(loader.load("en", "common")).thenReturn(pending);

        CompletableFuture<Void> load = store.loadNamespace("en", "common");
        store.clearLocaleCache("en");
        pending.complete(COMMON);
        load.get(1, TimeUnit.SECONDS);

        assertFalse(store.hasNamespace("en", "common"));
    }

    @Test
    void clearLocaleCache_shouldKeepOtherLocales() throws Exception {
        when(loader.load(anyString(), eq("common"))).thenReturn(CompletableFuture.completedFuture(COMMON));
        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);
        store.loadNamespace("es", "common").get(1, TimeUnit.SECONDS);

        store.clearLocaleCache("en");

        assertFalse(store.hasNamespace("en", "common"));
        assertTrue(store.hasNamespace("es", "common"));
    }

    @Test
    void clearCache_shouldAllowReloading() throws Exception {
        when(loader.load("en", "common")).thenReturn(CompletableFuture.completedFuture(COMMON));
        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);

        store.clearCache();
        assertFalse(store.hasNamespace("en", "common"));

        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);
        verify(loader, times(2)).load("en", "common");
    }

    // -- Lookup and ledger --

    @Test
    void getTranslation_shouldRecordMissingKeysOnce() throws Exception {
        when(loader.load("en", "common")).thenReturn(CompletableFuture.completedFuture(COMMON));
        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);

        assertNull(store.getTranslation("en", "common", "app.subtitle"));
        assertNull(store.getTranslation("en", "common", "app.subtitle"));
        assertNull(store.getTranslation("en", "common", "items"));

        assertEquals(List.of("en:common:app.subtitle", "en:common:items"), store.getMissingKeys());
    }

    @Test
    void getTranslation_shouldNotRecordWhenNamespaceNeverLoaded() {
        assertNull(store.getTranslation("en", "common", "app.title"));
        assertTrue(store.getMissingKeys().isEmpty());
    }

    @Test
    void clearCache_shouldResetLedger() throws Exception {
        when(loader.load("en", "common")).thenReturn(CompletableFuture.completedFuture(COMMON));
        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);
        store.getTranslation("en", "common", "nope");

        store.clearCache();

        assertTrue(store.getMissingKeys().isEmpty());
    }

    @Test
    void lookup_shouldReturnPluralEntryWithoutLedgerEntry() throws Exception {
        when(loader.load("en", "common")).thenReturn(CompletableFuture.completedFuture(COMMON));
        store.loadNamespace("en", "common").get(1, TimeUnit.SECONDS);

        assertInstanceOf(BundleEntry.Forms.class, store.lookup("en", "common", "items"));
        assertNull(store.lookup("en", "common", "absent"));
        assertTrue(store.getMissingKeys().isEmpty());
    }
}
