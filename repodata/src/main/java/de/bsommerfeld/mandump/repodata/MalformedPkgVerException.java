package de.bsommerfeld.mandump.repodata;

/**
 * Thrown by {@link PkgVer#parse(String)} for strings that are not of the form
 * {@code <name>-<version>_<revision>}.
 */
public class MalformedPkgVerException extends RepoDataException {

    public enum Reason {
        NO_NAME("missing name"),
        NO_VERSION("missing version"),
        NO_REVISION("missing revision"),
        BAD_REVISION("revision is not a valid integer >= 1"),
        MALFORMED_VERSION("version must not contain the characters : (colon) or - (hyphen)");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final String pkgver;
    private final Reason reason;

    public MalformedPkgVerException(String pkgver, Reason reason) {
        super("pkgver: cannot parse \"" + pkgver + "\": " + reason.description());
        this.pkgver = pkgver;
        this.reason = reason;
    }

    public String pkgver() {
        return pkgver;
    }

    public Reason reason() {
        return reason;
    }
}
