package de.bsommerfeld.g11n.core.locale;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;

/**
 * Built-in names and writing directions for common languages.
 */
final class LocaleMetadata {

    private static final Map<String, LocaleInfo> KNOWN = ImmutableMap.<String, LocaleInfo>builder()
            .put("en", ltr("en", "English", "English"))
            .put("es", ltr("es", "Spanish", "Español"))
            .put("fr", ltr("fr", "French", "Français"))
            .put("de", ltr("de", "German", "Deutsch"))
            .put("it", ltr("it", "Italian", "Italiano"))
            .put("pt", ltr("pt", "Portuguese", "Português"))
            .put("ru", ltr("ru", "Russian", "Русский"))
            .put("ja", ltr("ja", "Japanese", "日本語"))
            .put("zh", ltr("zh", "Chinese", "中文"))
            .put("ko", ltr("ko", "Korean", "한국어"))
            .put("ar", new LocaleInfo("ar", "Arabic", "العربية", TextDirection.RTL))
            .put("he", new LocaleInfo("he", "Hebrew", "עברית", TextDirection.RTL))
            .put("hi", ltr("hi", "Hindi", "हिन्दी"))
            .put("tr", ltr("tr", "Turkish", "Türkçe"))
            .put("pl", ltr("pl", "Polish", "Polski"))
            .put("nl", ltr("nl", "Dutch", "Nederlands"))
            .put("sv", ltr("sv", "Swedish", "Svenska"))
            .put("da", ltr("da", "Danish", "Dansk"))
            .put("fi", ltr("fi", "Finnish", "Suomi"))
            .put("no", ltr("no", "Norwegian", "Norsk"))
            .build();

    private LocaleMetadata() {
    }

    /** Known metadata, or the upper-cased code as both names and LTR. */
    static LocaleInfo lookup(String locale) {
        String code = LocaleCodes.normalize(locale);
        LocaleInfo info = KNOWN.get(code);
        if (info != null) {
            return info;
        }
        String label = code.toUpperCase(Locale.ROOT);
        return new LocaleInfo(code, label, label, TextDirection.LTR);
    }

    private static LocaleInfo ltr(String code, String name, String nativeName) {
        return new LocaleInfo(code, name, nativeName, TextDirection.LTR);
    }
}
