package de.bsommerfeld.g11n.core.locale;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Reads locale preferences from the POSIX locale variables and the JVM
 * default locale.
 *
 * <p>
 * Order: {@code LC_ALL}, {@code LC_MESSAGES}, {@code LANG}, then
 * {@link Locale#getDefault()}. Encoding and modifier suffixes
 * ({@code de_DE.UTF-8@euro}) are stripped and the {@code C}/{@code POSIX}
 * pseudo-locales are ignored.
 */
public class SystemHostLocaleSource implements HostLocaleSource {

    private static final String[] VARIABLES = { "LC_ALL", "LC_MESSAGES", "LANG" };

    private final Function<String, String> environment;

    public SystemHostLocaleSource() {
        this(System::getenv);
    }

    SystemHostLocaleSource(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public List<String> preferredLocales() {
        List<String> locales = new ArrayList<>();
        for (String variable : VARIABLES) {
            String tag = clean(environment.apply(variable));
            if (tag != null && !locales.contains(tag)) {
                locales.add(tag);
            }
        }
        String jvmDefault = Locale.getDefault().toLanguageTag();
        if (!"und".equals(jvmDefault) && !locales.contains(jvmDefault)) {
            locales.add(jvmDefault);
        }
        return locales;
    }

    static String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String tag = raw.trim();
        int cut = tag.length();
        int dot = tag.indexOf('.');
        int at = tag.indexOf('@');
        if (dot >= 0) {
            cut = Math.min(cut, dot);
        }
        if (at >= 0) {
            cut = Math.min(cut, at);
        }
        tag = tag.substring(0, cut);
        if (tag.isEmpty() || "C".equals(tag) || "POSIX".equals(tag)) {
            return null;
        }
        return tag;
    }
}
