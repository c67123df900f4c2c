/**
 * Manual page extraction from XBPS package archives.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 *   repodata files
 *        │  RepoData (one catalog per file)
 *        ▼
 *   ManDumper ──── OpenFileBudget (2 units per package)
 *        │
 *        ▼
 *   PackageDumper ── one ExtractionResult per package
 *        │
 *        ▼
 *   DumpCache ──── reconcile ──► StaleFileRemover
 *        │
 *        ▼
 *   CacheStore (cache file or stdout)
 * </pre>
 *
 * <h2>Packages</h2>
 *
 * <pre>
 * cache       prior/pending cache, JSON persistence, stale file removal
 * cli         picocli command and log level handling
 * concurrent  task groups with fail-fast cancellation, open-file budget
 * config      validated run settings and Guice wiring
 * event       run events and the outcome summary
 * extract     compression sniffing, files.plist manifest, per-package extraction
 * </pre>
 */
package de.bsommerfeld.mandump;
