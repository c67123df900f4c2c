package de.bsommerfeld.mandump.repodata;

import com.dd.plist.NSArray;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSNumber;
import com.dd.plist.NSObject;
import com.dd.plist.NSString;
import com.dd.plist.PropertyListParser;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Decodes an XBPS {@code index.plist} into {@link PackageMetadata} keyed by package name.
 *
 * <p>The index is a single dictionary whose keys are package names (without version) and
 * whose values are flat dictionaries of package properties. Both XML and binary property
 * lists are accepted. Unknown properties are ignored; missing ones take empty defaults.
 */
final class PlistPackageDecoder {

    private static final Pattern SCHEME = Pattern.compile("[A-Za-z][A-Za-z0-9+.-]*");

    private static final DateTimeFormatter BUILD_DATE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.ROOT);

    private PlistPackageDecoder() {
    }

    /**
     * Parses the raw property list bytes. Entries keep the order of the index.
     *
     * @throws RepoDataException if the bytes are not a property list, the root is not a
     *                           dictionary, or a property has an unexpected type
     */
    static Map<String, PackageMetadata> decode(byte[] plist) throws RepoDataException {
        NSObject root;
        try {
            root = PropertyListParser.parse(plist);
        } catch (Exception e) {
            throw new RepoDataException("Unable to decode index property list", e);
        }
        if (!(root instanceof NSDictionary)) {
            throw new RepoDataException("Index property list root is not a dictionary");
        }

        NSDictionary packages = (NSDictionary) root;
        Map<String, PackageMetadata> decoded = new LinkedHashMap<>();
        for (String name : packages.allKeys()) {
            NSObject value = packages.objectForKey(name);
            if (!(value instanceof NSDictionary)) {
                throw new RepoDataException("Index entry for " + name + " is not a dictionary");
            }
            decoded.put(name, decodePackage(name, (NSDictionary) value));
        }
        return decoded;
    }

    private static PackageMetadata decodePackage(String name, NSDictionary dict) throws RepoDataException {
        try {
            return new PackageMetadata(
                    string(dict, "pkgver"),
                    string(dict, "architecture"),
                    buildDate(string(dict, "build-date")),
                    string(dict, "build-options"),
                    string(dict, "filename-sha256"),
                    number(dict, "filename-size"),
                    homepage(string(dict, "homepage")),
                    number(dict, "installed_size"),
                    string(dict, "license"),
                    string(dict, "maintainer"),
                    string(dict, "short_desc"),
                    bool(dict, "preserve"),
                    string(dict, "source-revisions"),
                    strings(dict, "run_depends"),
                    strings(dict, "shlib-requires"),
                    strings(dict, "shlib-provides"),
                    strings(dict, "conflicts"),
                    strings(dict, "reverts"),
                    strings(dict, "replaces"),
                    alternatives(dict),
                    strings(dict, "conf_files"));
        } catch (IllegalArgumentException e) {
            throw new RepoDataException("Invalid index entry for " + name + ": " + e.getMessage(), e);
        }
    }

    // -- Property accessors --

    private static String string(NSDictionary dict, String key) {
        NSObject value = dict.objectForKey(key);
        if (value == null) return null;
        if (value instanceof NSString) return ((NSString) value).getContent();
        throw new IllegalArgumentException(key + " is not a string");
    }

    private static long number(NSDictionary dict, String key) {
        NSObject value = dict.objectForKey(key);
        if (value == null) return 0;
        if (value instanceof NSNumber) return ((NSNumber) value).longValue();
        throw new IllegalArgumentException(key + " is not a number");
    }

    private static boolean bool(NSDictionary dict, String key) {
        NSObject value = dict.objectForKey(key);
        if (value == null) return false;
        if (value instanceof NSNumber) return ((NSNumber) value).boolValue();
        throw new IllegalArgumentException(key + " is not a boolean");
    }

    private static List<String> strings(NSDictionary dict, String key) {
        return stringArray(key, dict.objectForKey(key));
    }

    private static List<String> stringArray(String key, NSObject value) {
        if (value == null) return List.of();
        if (!(value instanceof NSArray)) {
            throw new IllegalArgumentException(key + " is not an array");
        }
        List<String> out = new ArrayList<>();
        for (NSObject item : ((NSArray) value).getArray()) {
            if (!(item instanceof NSString)) {
                throw new IllegalArgumentException(key + " contains a non-string element");
            }
            out.add(((NSString) item).getContent());
        }
        return out;
    }

    private static Map<String, List<String>> alternatives(NSDictionary dict) {
        NSObject value = dict.objectForKey("alternatives");
        if (value == null) return Map.of();
        if (!(value instanceof NSDictionary)) {
            throw new IllegalArgumentException("alternatives is not a dictionary");
        }
        NSDictionary groups = (NSDictionary) value;
        Map<String, List<String>> out = new TreeMap<>();
        for (String group : groups.allKeys()) {
            out.put(group, stringArray("alternatives." + group, groups.objectForKey(group)));
        }
        return out;
    }

    // -- Text types --

    private static Instant buildDate(String text) {
        if (text == null) return null;
        try {
            return ZonedDateTime.parse(text, BUILD_DATE).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("build-date is not of the form yyyy-MM-dd HH:mm zone: " + text, e);
        }
    }

    private static URI homepage(String text) {
        if (text == null) return null;
        try {
            return new URI(text);
        } catch (URISyntaxException strict) {
            try {
                return quoted(text);
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("homepage is not a valid URL: " + text, strict);
            }
        }
    }

    /**
     * Re-parses {@code text} with characters such as spaces, {@code |} and braces
     * percent-encoded. Text that is still malformed, such as one with an invalid scheme,
     * is rejected.
     */
    private static URI quoted(String text) throws URISyntaxException {
        String rest = text;
        String fragment = null;
        int hash = rest.indexOf('#');
        if (hash >= 0) {
            fragment = rest.substring(hash + 1);
            rest = rest.substring(0, hash);
        }
        String scheme = null;
        int colon = rest.indexOf(':');
        if (colon > 0 && SCHEME.matcher(rest.substring(0, colon)).matches()) {
            scheme = rest.substring(0, colon);
            rest = rest.substring(colon + 1);
        }
        return new URI(scheme, rest, fragment);
    }
}
