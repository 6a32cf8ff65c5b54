package dev.badgersnacks.albionmarket.sources;

import dev.badgersnacks.albionmarket.catalog.RawItem;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the raw item dump that common names are generated from.
 */
public interface RawCatalogSource {
    List<RawItem> fetch() throws IOException;
}
