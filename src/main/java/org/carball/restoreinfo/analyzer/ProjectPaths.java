package org.carball.restoreinfo.analyzer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Rooting of MSBuild item paths. Works on path strings rather than {@link java.nio.file.Path} so
 * Windows-style project metadata ({@code C:\Src\App\}) resolves the same way on every host OS.
 */
public final class ProjectPaths {

    private static final char BACKSLASH = '\\';
    private static final char SLASH = '/';

    private ProjectPaths() {
    }

    /**
     * Makes {@code path} absolute using {@code basePath} when it is relative. The result is
     * normalized ({@code .} and {@code ..} segments collapsed) and uses the separator style of
     * the path it was rooted against.
     */
    public static String makeRooted(String basePath, String path) {
        Objects.requireNonNull(basePath, "basePath");
        Objects.requireNonNull(path, "path");

        if (isRooted(path)) {
            return normalize(path, separatorOf(path));
        }

        char separator = separatorOf(basePath);
        if (path.isEmpty()) {
            return normalize(basePath, separator);
        }
        return normalize(trimTrailingSeparators(basePath) + separator + path, separator);
    }

    public static boolean isRooted(String path) {
        if (path.isEmpty()) {
            return false;
        }
        return isSeparator(path.charAt(0)) || hasDriveLetter(path);
    }

    public static String trimTrailingSeparators(String path) {
        int end = path.length();
        while (end > 0 && isSeparator(path.charAt(end - 1))) {
            end--;
        }
        return path.substring(0, end);
    }

    /**
     * Directory part of a file path, without a trailing separator. Empty when the path has no
     * directory part.
     */
    public static String directoryOf(String filePath) {
        String trimmed = trimTrailingSeparators(filePath);
        int index = Math.max(trimmed.lastIndexOf(SLASH), trimmed.lastIndexOf(BACKSLASH));
        if (index < 0) {
            return hasDriveLetter(trimmed) ? trimmed.substring(0, 2) : "";
        }
        if (index == 0) {
            return trimmed.substring(0, 1);
        }
        if (index == 2 && hasDriveLetter(trimmed)) {
            return trimmed.substring(0, 3);
        }
        return trimmed.substring(0, index);
    }

    static char separatorOf(String path) {
        if (path.indexOf(BACKSLASH) >= 0 || hasDriveLetter(path)) {
            return BACKSLASH;
        }
        return SLASH;
    }

    static String normalize(String path, char separator) {
        String root;
        int start;
        boolean share = false;
        if (path.length() >= 2 && isSeparator(path.charAt(0)) && isSeparator(path.charAt(1))) {
            // UNC: server and share names belong to the root
            int serverEnd = nextSeparator(path, 2);
            int shareEnd = nextSeparator(path, Math.min(serverEnd + 1, path.length()));
            root = "" + separator + separator + path.substring(2, serverEnd);
            if (shareEnd > serverEnd + 1) {
                root += separator + path.substring(serverEnd + 1, shareEnd);
            }
            start = shareEnd;
            share = true;
        } else if (hasDriveLetter(path)) {
            boolean absolute = path.length() > 2 && isSeparator(path.charAt(2));
            root = path.substring(0, 2) + (absolute ? String.valueOf(separator) : "");
            start = absolute ? 3 : 2;
        } else if (!path.isEmpty() && isSeparator(path.charAt(0))) {
            root = String.valueOf(separator);
            start = 1;
        } else {
            root = "";
            start = 0;
        }

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.substring(start).split("[/\\\\]+")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
                    segments.removeLast();
                } else if (root.isEmpty()) {
                    segments.addLast(segment);
                }
                // Already at the root: ".." stays there
                continue;
            }
            segments.addLast(segment);
        }

        String joined = String.join(String.valueOf(separator), segments);
        if (share && !segments.isEmpty()) {
            return root + separator + joined;
        }
        return root + joined;
    }

    private static int nextSeparator(String path, int from) {
        for (int i = from; i < path.length(); i++) {
            if (isSeparator(path.charAt(i))) {
                return i;
            }
        }
        return path.length();
    }

    private static boolean isSeparator(char c) {
        return c == SLASH || c == BACKSLASH;
    }

    private static boolean hasDriveLetter(String path) {
        return path.length() >= 2
                && path.charAt(1) == ':'
                && ((path.charAt(0) >= 'A' && path.charAt(0) <= 'Z')
                || (path.charAt(0) >= 'a' && path.charAt(0) <= 'z'));
    }
}
