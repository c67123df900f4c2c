package de.bsommerfeld.mandump;

import de.bsommerfeld.mandump.repodata.RepoData;
import de.bsommerfeld.mandump.repodata.RepoPackage;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;
import org.apache.commons.compress.compressors.xz.XZCompressorOutputStream;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds XBPS package archives, manifests and repodata files for tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * A tar entry: a regular file with content, or a link of {@code linkType} when
     * {@code linkTarget} is set.
     */
    public record Entry(String name, String content, String linkTarget, byte linkType) {

        public static Entry file(String name, String content) {
            return new Entry(name, content, null, TarConstants.LF_NORMAL);
        }

        public static Entry link(String name, String target) {
            return new Entry(name, null, target, TarConstants.LF_SYMLINK);
        }

        public static Entry hardLink(String name, String target) {
            return new Entry(name, null, target, TarConstants.LF_LINK);
        }
    }

    public enum Format { XZ, ZSTD }

    // -- Package archives --

    public static String manifest(List<String> dirs, List<String> files, List<String> links) {
        StringBuilder xml = new StringBuilder("""
                <?xml version="1.0" encoding="UTF-8"?>
                <!DOCTYPE plist PUBLIC "-//Apple//DTD PLIST 1.0//EN" "http://www.apple.com/DTDs/PropertyList-1.0.dtd">
                <plist version="1.0">
                <dict>
                """);
        appendGroup(xml, "dirs", dirs);
        appendGroup(xml, "files", files);
        appendGroup(xml, "links", links);
        xml.append("</dict>\n</plist>\n");
        return xml.toString();
    }

    private static void appendGroup(StringBuilder xml, String key, List<String> paths) {
        if (paths.isEmpty()) return;
        xml.append("<key>").append(key).append("</key>\n<array>\n");
        for (String p : paths) {
            xml.append("<dict><key>file</key><string>").append(p).append("</string></dict>\n");
        }
        xml.append("</array>\n");
    }

    public static byte[] archive(Format format, List<Entry> entries) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(compressor(format, buffer))) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (Entry e : entries) {
                if (e.linkTarget() != null) {
                    TarArchiveEntry entry = new TarArchiveEntry(e.name(), e.linkType());
                    entry.setLinkName(e.linkTarget());
                    tar.putArchiveEntry(entry);
                } else {
                    byte[] data = e.content().getBytes(StandardCharsets.UTF_8);
                    TarArchiveEntry entry = new TarArchiveEntry(e.name());
                    entry.setSize(data.length);
                    tar.putArchiveEntry(entry);
                    tar.write(data);
                }
                tar.closeArchiveEntry();
            }
        }
        return buffer.toByteArray();
    }

    private static OutputStream compressor(Format format, OutputStream out) throws IOException {
        return format == Format.XZ ? new XZCompressorOutputStream(out) : new ZstdCompressorOutputStream(out);
    }

    /**
     * Archive of a package that installs {@code pages} (paths below {@code usr/share/man/})
     * and nothing else.
     */
    public static byte[] manPackage(Format format, String... pages) throws IOException {
        List<String> dirs = new ArrayList<>();
        List<String> files = new ArrayList<>();
        List<Entry> entries = new ArrayList<>();
        for (String page : pages) {
            String path = "/usr/share/man/" + page;
            String dir = path.substring(0, path.lastIndexOf('/'));
            if (!dirs.contains(dir)) dirs.add(dir);
            files.add(path);
            entries.add(Entry.file("." + path, "page " + page));
        }
        entries.add(0, Entry.file("./files.plist", manifest(dirs, files, List.of())));
        return archive(format, entries);
    }

    // -- Repodata --

    public static String indexEntry(String name, String pkgver, String sha256) {
        return """
                  <key>%s</key>
                  <dict>
                    <key>pkgver</key><string>%s</string>
                    <key>architecture</key><string>x86_64</string>
                    <key>filename-sha256</key><string>%s</string>
                  </dict>
                """.formatted(name, pkgver, sha256);
    }

    public static byte[] index(String... entries) {
        StringBuilder xml = new StringBuilder("""
                <?xml version="1.0" encoding="UTF-8"?>
                <!DOCTYPE plist PUBLIC "-//Apple//DTD PLIST 1.0//EN" "http://www.apple.com/DTDs/PropertyList-1.0.dtd">
                <plist version="1.0">
                <dict>
                """);
        for (String e : entries) {
            xml.append(e);
        }
        xml.append("</dict>\n</plist>\n");
        return xml.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Writes a zstd repodata archive holding {@code index.plist} to {@code file}.
     */
    public static Path writeRepodata(Path file, String... entries) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] index = index(entries);
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(new ZstdCompressorOutputStream(buffer))) {
            TarArchiveEntry entry = new TarArchiveEntry("index.plist");
            entry.setSize(index.length);
            tar.putArchiveEntry(entry);
            tar.write(index);
            tar.closeArchiveEntry();
        }
        Files.createDirectories(file.toAbsolutePath().getParent());
        return Files.write(file, buffer.toByteArray());
    }

    /**
     * Returns a catalog package, decoded through {@link RepoData} like a real one.
     */
    public static RepoPackage repoPackage(String name, String pkgver, String sha256) {
        RepoData rd = new RepoData();
        try {
            rd.readRepoIndex(new ByteArrayInputStream(index(indexEntry(name, pkgver, sha256))), null);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
        return rd.packageNamed(name);
    }
}
