package ai.catalog.translator.catalog;

import java.util.Optional;

/**
 * Opens the existing catalog of a target locale, if there is one.
 */
@FunctionalInterface
public interface CatalogSource {

    Optional<CatalogTransformer> open(String locale);
}
