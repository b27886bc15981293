package de.bsommerfeld.g11n.storage;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.function.Function;

/**
 * Resolves the per-user application data directory in which the chosen
 * locale is remembered. Paths are returned but <strong>not</strong> created.
 *
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class AppDataDirectories {

    static final String PREFERENCES_FILE = "g11n.properties";

    private AppDataDirectories() {
    }

    public static Path getAppDataDir(String appName) {
        return resolve(System.getProperty("os.name", "generic"), System::getenv,
                System.getProperty("user.home"), appName);
    }

    /** The properties file that stores the persisted locale for {@code appName}. */
    public static Path getPreferencesFile(String appName) {
        return getAppDataDir(appName).resolve(PREFERENCES_FILE);
    }

    static Path resolve(String osName, Function<String, String> env, String userHome, String appName) {
        String os = osName.toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(userHome, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = env.apply("APPDATA");
            if (appData != null && !appData.isEmpty()) {
                return Paths.get(appData, appName);
            }
            return Paths.get(userHome, "AppData", "Roaming", appName);
        }
        String xdgData = env.apply("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(userHome, ".local", "share", appName);
    }
}
