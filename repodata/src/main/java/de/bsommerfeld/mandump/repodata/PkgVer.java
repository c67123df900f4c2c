package de.bsommerfeld.mandump.repodata;

import de.bsommerfeld.mandump.repodata.MalformedPkgVerException.Reason;

/**
 * Name, version and revision of a package, as combined in an XBPS pkgver string
 * ({@code <name>-<version>_<revision>}).
 *
 * @param name     package name, may itself contain hyphens
 * @param version  version without hyphens or colons
 * @param revision revision, always {@code >= 1}
 */
public record PkgVer(String name, String version, int revision) {

    /**
     * Parses a pkgver string. The revision is taken after the last underscore and the
     * version after the last hyphen preceding it.
     *
     * @throws MalformedPkgVerException if any of the three parts is missing or invalid
     */
    public static PkgVer parse(String s) throws MalformedPkgVerException {
        int revSep = s.lastIndexOf('_');
        if (revSep == -1 || revSep == s.length() - 1) {
            throw new MalformedPkgVerException(s, Reason.NO_REVISION);
        }

        int revision;
        try {
            revision = Integer.parseInt(s.substring(revSep + 1));
        } catch (NumberFormatException e) {
            throw new MalformedPkgVerException(s, Reason.BAD_REVISION);
        }
        if (revision <= 0) {
            throw new MalformedPkgVerException(s, Reason.BAD_REVISION);
        }

        int versionSep = s.lastIndexOf('-', revSep - 1);
        if (versionSep == -1) {
            throw new MalformedPkgVerException(s, Reason.NO_VERSION);
        }

        String version = s.substring(versionSep + 1, revSep);
        if (version.isEmpty()) {
            throw new MalformedPkgVerException(s, Reason.NO_VERSION);
        }
        if (version.indexOf(':') != -1 || version.indexOf('-') != -1) {
            throw new MalformedPkgVerException(s, Reason.MALFORMED_VERSION);
        }

        String name = s.substring(0, versionSep);
        if (name.isEmpty()) {
            throw new MalformedPkgVerException(s, Reason.NO_NAME);
        }

        return new PkgVer(name, version, revision);
    }

    @Override
    public String toString() {
        return name + "-" + version + "_" + revision;
    }
}
