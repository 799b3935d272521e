package org.broadinstitute.wombat.utils.runtime;

import org.apache.commons.lang3.StringUtils;

import java.io.File;

public final class RuntimeUtils {
    public static final String[] PATHS;

    static {
        String path = System.getenv("PATH");
        if (path == null)
            path = System.getenv("path");
        if (path == null) {
            PATHS = new String[0];
        } else {
            PATHS = StringUtils.split(path, File.pathSeparatorChar);
        }
    }

    private RuntimeUtils() {}

    /**
     * Returns the path to an executable or null if it doesn't exist.
     * An executable given with a path component is checked directly.
     * @param executable Relative path
     * @return The absolute file path.
     */
    public static File which(final String executable) {
        if (executable.indexOf(File.separatorChar) >= 0) {
            final File direct = new File(executable);
            return direct.canExecute() ? direct.getAbsoluteFile() : null;
        }
        for (final String path: PATHS) {
            final File file = new File(path, executable);
            if (file.exists() && file.canExecute())
                return file.getAbsoluteFile();
        }
        return null;
    }

    /**
     * @return get the implementation version of the given class
     */
    public static String getVersion(final Class<?> clazz){
        final String versionString = clazz.getPackage().getImplementationVersion();
        return versionString != null ? versionString : "Unavailable";
    }
}
