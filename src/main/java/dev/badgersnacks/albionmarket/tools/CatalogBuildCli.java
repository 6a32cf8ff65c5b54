package dev.badgersnacks.albionmarket.tools;

import dev.badgersnacks.albionmarket.catalog.CatalogJsonCodec;
import dev.badgersnacks.albionmarket.catalog.CommonNameGenerator;
import dev.badgersnacks.albionmarket.catalog.ItemCatalog;
import dev.badgersnacks.albionmarket.catalog.RawItem;
import dev.badgersnacks.albionmarket.persistence.CatalogCacheStorage;
import dev.badgersnacks.albionmarket.sources.HttpRawCatalogSource;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Downloads the item dump, generates common names and writes the enriched catalog the lookup tools read.
 */
public final class CatalogBuildCli {

    private CatalogBuildCli() {
    }

    public static void main(String[] args) throws IOException {
        if (args.length < 1) {
            System.err.println("""
                    Usage: CatalogBuildCli <outputFile> [--url <itemDumpUrl>]

                    <outputFile> Destination JSON file (directories are created automatically).
                    --url        Item dump to read instead of the ao-bin-dumps formatted items.json.
                    """);
            System.exit(1);
        }

        Path outputFile = Paths.get(args[0]).toAbsolutePath().normalize();
        URI source = URI.create(HttpRawCatalogSource.DEFAULT_URL);
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--url" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--url requires a URL argument");
                    }
                    source = URI.create(args[++i]);
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        CatalogJsonCodec codec = new CatalogJsonCodec();
        List<RawItem> rawItems = new HttpRawCatalogSource(source).fetch();
        ItemCatalog catalog = new ItemCatalog(new CommonNameGenerator().enrich(rawItems));
        new CatalogCacheStorage(outputFile, codec).save(catalog);

        long aliases = catalog.items().stream().mapToLong(item -> item.commonNames().size()).sum();
        System.out.printf("Enriched %d items with %d common names. Catalog written to %s%n",
                catalog.size(), aliases, outputFile);
    }
}
