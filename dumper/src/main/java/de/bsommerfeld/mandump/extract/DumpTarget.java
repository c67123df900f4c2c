package de.bsommerfeld.mandump.extract;

/**
 * The part of a package's file tree that is extracted.
 *
 * @param dirsPrefix package path prefix (no leading slash) that marks a target file or
 *                   directory
 * @param trimPrefix prefix stripped from package paths to form output paths
 */
public record DumpTarget(String dirsPrefix, String trimPrefix) {

    /** Manual pages: {@code usr/share/man/manN/...} is written as {@code manN/...}. */
    public static final DumpTarget MAN_PAGES = new DumpTarget("usr/share/man/man", "usr/share/man/");

    public DumpTarget {
        if (!dirsPrefix.startsWith(trimPrefix)) {
            throw new IllegalArgumentException("dirsPrefix must start with trimPrefix");
        }
    }

    /**
     * Returns whether a normalized package path belongs to the target tree.
     */
    public boolean contains(String packagePath) {
        return packagePath.startsWith(dirsPrefix);
    }

    /**
     * Strips {@link #trimPrefix()} from a path inside the target tree.
     */
    public String outputPath(String packagePath) {
        return packagePath.substring(trimPrefix.length());
    }

    /**
     * Normalizes a tar entry or manifest path: leading {@code ./} and {@code /} are removed.
     */
    public static String normalize(String path) {
        String p = path;
        while (true) {
            if (p.startsWith("./")) {
                p = p.substring(2);
            } else if (p.startsWith("/")) {
                p = p.substring(1);
            } else {
                return p;
            }
        }
    }
}
