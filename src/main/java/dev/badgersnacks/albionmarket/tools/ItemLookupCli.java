package dev.badgersnacks.albionmarket.tools;

import dev.badgersnacks.albionmarket.catalog.CatalogJsonCodec;
import dev.badgersnacks.albionmarket.catalog.CommonNameGenerator;
import dev.badgersnacks.albionmarket.catalog.ItemCatalogService;
import dev.badgersnacks.albionmarket.logging.LookupAuditLog;
import dev.badgersnacks.albionmarket.matching.FuzzyItemMatcher;
import dev.badgersnacks.albionmarket.persistence.CatalogCacheStorage;
import dev.badgersnacks.albionmarket.persistence.ResolverSettings;
import dev.badgersnacks.albionmarket.services.ItemLookupService;
import dev.badgersnacks.albionmarket.services.ItemLookupService.LookupResult;
import dev.badgersnacks.albionmarket.services.ItemLookupService.ResolvedItem;
import dev.badgersnacks.albionmarket.sources.HttpRawCatalogSource;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves an item query from the command line, building the catalog cache first when it does not exist.
 */
public final class ItemLookupCli {

    private ItemLookupCli() {
    }

    public static void main(String[] args) throws IOException {
        Path settingsFile = null;
        Integer topK = null;
        boolean refresh = false;
        List<String> words = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--settings" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--settings requires a path argument");
                    }
                    settingsFile = Paths.get(args[++i]).toAbsolutePath().normalize();
                }
                case "--top" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--top requires a number argument");
                    }
                    topK = parseTopK(args[++i]);
                }
                case "--refresh" -> refresh = true;
                default -> words.add(args[i]);
            }
        }
        if (words.isEmpty()) {
            System.err.println("""
                    Usage: ItemLookupCli <item name...> [--settings <file>] [--top <k>] [--refresh]

                    <item name>  What a player would type, e.g. "t4.1 dagger" or "adept's bag".
                    --settings   JSON settings file (catalogUrl, cacheFile, topK, auditLogDirectory).
                    --top        Number of ranked matches to show, primary included.
                    --refresh    Rebuild the catalog cache from the item dump before matching.
                    """);
            System.exit(1);
        }

        ResolverSettings settings = ResolverSettings.load(settingsFile);
        CatalogJsonCodec codec = new CatalogJsonCodec();
        ItemCatalogService catalogService = new ItemCatalogService(
                new HttpRawCatalogSource(settings.catalogUri()),
                new CatalogCacheStorage(settings.cachePath(), codec),
                new CommonNameGenerator());
        if (refresh) {
            catalogService.refresh();
        } else {
            catalogService.load();
        }
        ItemLookupService lookupService = new ItemLookupService(
                catalogService, new FuzzyItemMatcher(), topK != null ? topK : settings.topK());

        String query = String.join(" ", words);
        Path auditDir = settings.auditLogPath();
        if (auditDir == null) {
            print(lookupService.lookup(query), System.out);
            return;
        }
        try (LookupAuditLog auditLog = LookupAuditLog.open(auditDir)) {
            try {
                LookupResult result = lookupService.lookup(query);
                auditLog.record(result);
                print(result, System.out);
            } catch (RuntimeException e) {
                auditLog.recordFailure(query, e);
                throw e;
            }
        }
    }

    static int parseTopK(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--top requires a number argument but got '" + value + "'", e);
        }
    }

    static void print(LookupResult result, PrintStream out) {
        ResolvedItem primary = result.primary();
        out.printf("%s (%s)%n", primary.displayName(), primary.uniqueId());
        if (primary.iconUrl() != null) {
            out.printf("  icon: %s%n", primary.iconUrl());
        }
        if (!result.suggestions().isEmpty()) {
            out.println("Suggestions:");
            for (ResolvedItem suggestion : result.suggestions()) {
                out.printf("  %s (%s)%n", suggestion.displayName(), suggestion.uniqueId());
            }
        }
    }
}
