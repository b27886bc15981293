package de.bsommerfeld.g11n.core.event;

import com.google.inject.Singleton;
import de.bsommerfeld.g11n.core.config.G11nConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.List;

/**
 * Side channel for missing translations and missing interpolation variables.
 *
 * <p>
 * Every report is logged and posted on the event bus. With
 * {@link G11nConfig#isDebug() debug} enabled the log lines are emitted at
 * WARN, otherwise at DEBUG.
 */
@Singleton
public class Diagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    private final G11nEventBus eventBus;
    private final Level level;

    @Inject
    public Diagnostics(G11nEventBus eventBus, G11nConfig config) {
        this(eventBus, config.isDebug());
    }

    public Diagnostics(G11nEventBus eventBus, boolean debug) {
        this.eventBus = eventBus;
        this.level = debug ? Level.WARN : Level.DEBUG;
    }

    /** Diagnostics that only log at DEBUG and post nowhere. */
    public static Diagnostics silent() {
        return new Diagnostics(null, false);
    }

    public boolean isVerbose() {
        return level == Level.WARN;
    }

    public void missingTranslation(String locale, String namespace, String key) {
        LOG.atLevel(level).log("Missing translation: {} (locale={}, namespace={})", key, locale, namespace);
        post(new G11nEvents.MissingTranslationEvent(locale, namespace, key));
    }

    public void missingVariables(String template, List<String> variables) {
        LOG.atLevel(level).log("Missing interpolation values: {}", String.join(", ", variables));
        post(new G11nEvents.MissingVariablesEvent(template, variables));
    }

    public void post(Object event) {
        if (eventBus != null) {
            eventBus.post(event);
        }
    }
}
