/**
 * Reader for XBPS repository data.
 *
 * <h2>Input</h2>
 * A repository snapshot ({@code <arch>-repodata}) is a zstd-compressed tar archive. The
 * only entry read here is {@code index.plist}, a property list dictionary mapping each
 * package name to its metadata:
 *
 * <pre>
 * &lt;dict&gt;
 *   &lt;key&gt;mandoc&lt;/key&gt;
 *   &lt;dict&gt;
 *     &lt;key&gt;pkgver&lt;/key&gt;          &lt;string&gt;mandoc-1.14.5_4&lt;/string&gt;
 *     &lt;key&gt;architecture&lt;/key&gt;    &lt;string&gt;x86_64&lt;/string&gt;
 *     &lt;key&gt;filename-sha256&lt;/key&gt; &lt;string&gt;9f1c...&lt;/string&gt;
 *     ...
 *   &lt;/dict&gt;
 * &lt;/dict&gt;
 * </pre>
 *
 * <h2>Class responsibilities</h2>
 *
 * <pre>
 * RepoData               catalog: merge, sort, lookup, aggregate etag
 * RepoPackage            one catalog entry with its per-package etag
 * PackageMetadata        decoded index properties
 * PlistPackageDecoder    property list → PackageMetadata
 * PkgVer                 &lt;name&gt;-&lt;version&gt;_&lt;revision&gt; parser
 * PackageFilter          order-preserving, chunked parallel filter
 * </pre>
 */
package de.bsommerfeld.mandump.repodata;
