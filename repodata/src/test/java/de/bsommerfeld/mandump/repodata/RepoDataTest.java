package de.bsommerfeld.mandump.repodata;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static de.bsommerfeld.mandump.repodata.RepoFixtures.entry;
import static de.bsommerfeld.mandump.repodata.RepoFixtures.index;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RepoData: index decoding, merging, ordering and fingerprints.
 */
class RepoDataTest {

    private RepoData repoData;

    @BeforeEach
    void setUp() {
        repoData = new RepoData();
    }

    private void merge(byte[] plist, String repo) throws Exception {
        repoData.readRepoIndex(new ByteArrayInputStream(plist), repo);
    }

    // -- decoding --

    @Test
    void readRepoIndex_shouldDecodePackageFields() throws Exception {
        merge(index(entry("mandoc", "mandoc-1.14.5_4", "aaa",
                "<key>homepage</key><string>https://mandoc.bsd.lv</string>"
                        + "<key>preserve</key><true/>"
                        + "<key>alternatives</key><dict><key>man</key>"
                        + "<array><string>man:/usr/bin/mandoc</string></array></dict>")), "main");

        RepoPackage p = repoData.packageNamed("mandoc");
        assertNotNull(p);
        assertEquals("mandoc", p.name());
        assertEquals("1.14.5", p.version());
        assertEquals(4, p.revision());
        assertEquals("mandoc-1.14.5_4", p.pkgver());
        assertEquals("x86_64", p.architecture());
        assertEquals("aaa", p.filenameSha256());
        assertEquals("main", p.repository());
        assertEquals(1024, p.metadata().filenameSize());
        assertEquals(Instant.parse("2020-05-22T10:13:00Z"), p.metadata().buildDate());
        assertEquals("https://mandoc.bsd.lv", p.metadata().homepage().toString());
        assertTrue(p.metadata().preserve());
        assertEquals(List.of("glibc>=2.29_1"), p.metadata().runDepends());
        assertEquals(List.of("man:/usr/bin/mandoc"), p.metadata().alternatives().get("man"));
        assertEquals("mandoc-1.14.5_4.x86_64.xbps", p.archiveFileName());
    }

    @Test
    void readRepoIndex_shouldDefaultRepositoryLabel() throws Exception {
        merge(index(entry("zsh", "zsh-5.8_1", "z")), null);
        assertEquals(RepoData.DEFAULT_REPOSITORY, repoData.packageNamed("zsh").repository());

        merge(index(entry("bash", "bash-5.0_1", "b")), "");
        assertEquals(RepoData.DEFAULT_REPOSITORY, repoData.packageNamed("bash").repository());
    }

    @Test
    void readRepoIndex_shouldRejectNonPlist() {
        byte[] garbage = "definitely not a plist".getBytes(StandardCharsets.UTF_8);
        assertThrows(RepoDataException.class, () -> merge(garbage, null));
    }

    @Test
    void readRepoIndex_shouldRejectBadBuildDate() {
        byte[] plist = index(entry("a", "a-1_1", "x").replace("2020-05-22 10:13 UTC", "yesterday"));
        assertThrows(RepoDataException.class, () -> merge(plist, null));
    }

    @Test
    void readRepoIndex_shouldQuoteCharactersUriRejects() throws Exception {
        merge(index(entry("odd", "odd-1_1", "o",
                "<key>homepage</key><string>https://example.org/a b|{c}#top</string>")), null);

        URI homepage = repoData.packageNamed("odd").metadata().homepage();
        assertEquals("https://example.org/a%20b%7C%7Bc%7D#top", homepage.toString());
        assertEquals("example.org", homepage.getHost());
    }

    @Test
    void readRepoIndex_shouldRejectHomepageWithInvalidScheme() {
        byte[] plist = index(entry("odd", "odd-1_1", "o",
                "<key>homepage</key><string>1http://example.org/a b</string>"));
        assertThrows(RepoDataException.class, () -> merge(plist, null));
    }

    // -- merge --

    @Test
    void readRepoIndex_shouldSortByNameAndAssignIndices() throws Exception {
        merge(index(entry("zsh", "zsh-5.8_1", "z"), entry("bash", "bash-5.0_1", "b")), null);
        merge(index(entry("mksh", "mksh-R59_1", "m")), null);

        assertEquals(List.of("bash", "mksh", "zsh"), repoData.nameIndex());
        List<RepoPackage> packages = repoData.index();
        for (int i = 0; i < packages.size(); i++) {
            assertEquals(i, packages.get(i).index());
        }
    }

    @Test
    void readRepoIndex_shouldReplaceExistingPackageInPlace() throws Exception {
        merge(index(entry("bash", "bash-5.0_1", "old"), entry("zsh", "zsh-5.8_1", "z")), null);
        merge(index(entry("bash", "bash-5.1_1", "new")), null);

        assertEquals(2, repoData.size());
        RepoPackage bash = repoData.packageNamed("bash");
        assertEquals("5.1", bash.version());
        assertEquals("new", bash.filenameSha256());
        assertSame(bash, repoData.index().get(0));
    }

    @Test
    void readRepoIndex_shouldKeepOnePackagePerName() throws Exception {
        merge(index(entry("a", "a-1_1", "1"), entry("b", "b-1_1", "2")), null);
        merge(index(entry("b", "b-2_1", "3"), entry("c", "c-1_1", "4")), null);
        merge(index(entry("a", "a-3_1", "5")), null);

        List<String> names = repoData.index().stream().map(RepoPackage::name).collect(Collectors.toList());
        assertEquals(List.of("a", "b", "c"), names);
        assertEquals(names.size(), Set.copyOf(names).size());
    }

    @Test
    void readRepoIndex_shouldNeverRemovePackages() throws Exception {
        merge(index(entry("a", "a-1_1", "1"), entry("b", "b-1_1", "2")), null);
        merge(index(entry("c", "c-1_1", "3")), null);

        assertNotNull(repoData.packageNamed("a"));
        assertNotNull(repoData.packageNamed("b"));
        assertNotNull(repoData.packageNamed("c"));
    }

    @Test
    void readRepoIndex_shouldFailOnMalformedPkgverWithoutPartialRecord() throws Exception {
        merge(index(entry("a", "a-1_1", "1")), null);
        String etagBefore = repoData.etag();

        byte[] plist = index(entry("b", "b-1_1", "2"), entry("nameonly", "nameonly", "3"));
        assertThrows(MalformedPkgVerException.class, () -> merge(plist, null));

        assertEquals(List.of("a"), repoData.nameIndex());
        assertNull(repoData.packageNamed("b"));
        assertNull(repoData.packageNamed("nameonly"));
        assertEquals(etagBefore, repoData.etag());
    }

    @Test
    void readRepoIndex_shouldFailWhenPkgverMissing() {
        byte[] plist = index("<key>x</key><dict><key>architecture</key><string>noarch</string></dict>");
        assertThrows(MalformedPkgVerException.class, () -> merge(plist, null));
    }

    // -- fingerprints --

    @Test
    void etag_shouldBeIdempotentForSameContent() throws Exception {
        byte[] plist = index(entry("a", "a-1_1", "1"), entry("b", "b-1_1", "2"));

        merge(plist, null);
        String first = repoData.etag();
        merge(plist, null);

        assertEquals(first, repoData.etag());
    }

    @Test
    void etag_shouldMatchAcrossIndependentCatalogs() throws Exception {
        byte[] plist = index(entry("a", "a-1_1", "1"), entry("b", "b-1_1", "2"));
        merge(plist, null);

        RepoData other = new RepoData();
        other.readRepoIndex(new ByteArrayInputStream(plist), null);

        assertEquals(repoData.etag(), other.etag());
        assertEquals(repoData.packageNamed("a").etag(), other.packageNamed("a").etag());
    }

    @Test
    void etag_shouldChangeWhenAnyMetadataChanges() throws Exception {
        merge(index(entry("a", "a-1_1", "1")), null);
        String packageEtag = repoData.packageNamed("a").etag();
        String catalogEtag = repoData.etag();

        merge(index(entry("a", "a-1_1", "1").replace("MIT", "BSD-2-Clause")), null);

        assertNotEquals(packageEtag, repoData.packageNamed("a").etag());
        assertNotEquals(catalogEtag, repoData.etag());
    }

    @Test
    void etag_shouldChangeWithRepositoryLabel() throws Exception {
        merge(index(entry("a", "a-1_1", "1")), "one");
        String first = repoData.packageNamed("a").etag();
        merge(index(entry("a", "a-1_1", "1")), "two");

        assertNotEquals(first, repoData.packageNamed("a").etag());
    }

    @Test
    void etag_shouldBeWeakEntityTag() throws Exception {
        merge(index(entry("a", "a-1_1", "1")), null);

        assertTrue(repoData.etag().startsWith("W/\""));
        assertTrue(repoData.packageNamed("a").etag().startsWith("W/\""));
    }

    @Test
    void etag_shouldBeDefinedForEmptyCatalog() {
        assertNotNull(repoData.etag());
        assertTrue(repoData.index().isEmpty());
    }

    // -- archives --

    @Test
    void readRepo_shouldLocateIndexInsideArchive() throws Exception {
        Map<String, byte[]> files = new LinkedHashMap<>();
        files.put("index-meta.plist", index());
        files.put("index.plist", index(entry("a", "a-1_1", "1")));

        repoData.readRepo(new ByteArrayInputStream(RepoFixtures.zstdTar(files)), "main");

        assertEquals(List.of("a"), repoData.nameIndex());
    }

    @Test
    void readRepo_shouldFailWithoutIndex() throws Exception {
        byte[] archive = RepoFixtures.zstdTar(Map.of("index-meta.plist", index()));

        assertThrows(NoIndexException.class,
                () -> repoData.readRepo(new ByteArrayInputStream(archive), null));
    }

    @Test
    void readRepo_shouldRejectUncompressedInput() {
        byte[] plain = index(entry("a", "a-1_1", "1"));
        assertThrows(IOException.class, () -> repoData.readRepo(new ByteArrayInputStream(plain), null));
    }

    @Test
    void loadRepo_shouldReadFromPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("x86_64-repodata");
        Files.write(file, RepoFixtures.zstdTar(Map.of("./index.plist", index(entry("a", "a-1_1", "1")))));

        repoData.loadRepo(file, null);

        assertNotNull(repoData.packageNamed("a"));
    }
}
