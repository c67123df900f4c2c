package de.bsommerfeld.mandump.event;

import de.bsommerfeld.mandump.extract.ExtractionResult;

/**
 * Posted once per package after its result has been recorded.
 *
 * @param repository label of the catalog the package came from
 * @param pkgver     package version string
 * @param result     what the worker produced
 */
public record PackageDumpedEvent(String repository, String pkgver, ExtractionResult result) {
}
