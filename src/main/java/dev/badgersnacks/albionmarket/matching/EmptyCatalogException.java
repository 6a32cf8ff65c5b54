package dev.badgersnacks.albionmarket.matching;

/**
 * Raised when a query is matched against a catalog that holds no items.
 */
public class EmptyCatalogException extends RuntimeException {

    public EmptyCatalogException(String message) {
        super(message);
    }
}
