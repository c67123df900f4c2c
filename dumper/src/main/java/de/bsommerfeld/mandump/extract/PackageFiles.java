package de.bsommerfeld.mandump.extract;

import com.dd.plist.NSArray;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSObject;
import com.dd.plist.NSString;
import com.dd.plist.PropertyListParser;
import de.bsommerfeld.mandump.DumpException;

import java.util.ArrayList;
import java.util.List;

/**
 * A package's {@code files.plist}: everything the package installs, as absolute paths.
 *
 * @param files regular files
 * @param dirs  directories
 * @param links symbolic links
 */
public record PackageFiles(List<String> files, List<String> dirs, List<String> links) {

    /** Name of the manifest entry inside a package archive. */
    public static final String MANIFEST = "files.plist";

    public PackageFiles {
        files = List.copyOf(files);
        dirs = List.copyOf(dirs);
        links = List.copyOf(links);
    }

    /**
     * A package without directories installs nothing worth scanning.
     */
    public boolean isEmpty() {
        return dirs.isEmpty();
    }

    /**
     * Returns whether any declared directory lies under the target tree.
     */
    public boolean touches(DumpTarget target) {
        for (String dir : dirs) {
            if (target.contains(DumpTarget.normalize(dir))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the normalized paths of all files and links under the target tree.
     */
    public List<String> targetEntries(DumpTarget target) {
        List<String> out = new ArrayList<>();
        for (List<String> group : List.of(files, links)) {
            for (String path : group) {
                String normalized = DumpTarget.normalize(path);
                if (target.contains(normalized)) {
                    out.add(normalized);
                }
            }
        }
        return out;
    }

    /**
     * Decodes a manifest property list.
     *
     * @throws DumpException if the data is not a property list of the expected shape
     */
    public static PackageFiles decode(byte[] plist) throws DumpException {
        NSObject root;
        try {
            root = PropertyListParser.parse(plist);
        } catch (Exception e) {
            throw new DumpException("Error decoding files list", e);
        }
        if (!(root instanceof NSDictionary)) {
            throw new DumpException("Error decoding files list: root is not a dictionary");
        }
        NSDictionary dict = (NSDictionary) root;
        return new PackageFiles(paths(dict, "files"), paths(dict, "dirs"), paths(dict, "links"));
    }

    private static List<String> paths(NSDictionary dict, String key) throws DumpException {
        NSObject value = dict.objectForKey(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof NSArray)) {
            throw new DumpException("Error decoding files list: " + key + " is not an array");
        }
        List<String> out = new ArrayList<>();
        for (NSObject item : ((NSArray) value).getArray()) {
            if (!(item instanceof NSDictionary)) {
                throw new DumpException("Error decoding files list: " + key + " entry is not a dictionary");
            }
            NSObject file = ((NSDictionary) item).objectForKey("file");
            if (!(file instanceof NSString)) {
                throw new DumpException("Error decoding files list: " + key + " entry has no file");
            }
            out.add(((NSString) file).getContent());
        }
        return out;
    }
}
