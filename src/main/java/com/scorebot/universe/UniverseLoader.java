package com.scorebot.universe;

import com.scorebot.model.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the symbol universe from a CSV file with columns {@code ticker,sector,asset_type}.
 * The header row is optional and lines starting with {@code #} are skipped.
 */
public final class UniverseLoader {
    private static final Logger LOG = LogManager.getLogger(UniverseLoader.class);

    private UniverseLoader() {
    }

    public static List<Symbol> loadCsv(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IOException("universe file not found: " + (path == null ? "-" : path.toAbsolutePath()));
        }
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    /**
     * Tickers are upper-cased, the first occurrence of a duplicate wins and non-equity rows are dropped.
     */
    public static List<Symbol> parse(List<String> lines) {
        Map<String, Symbol> out = new LinkedHashMap<>();
        int skippedNonEquity = 0;
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw == null ? "" : raw.trim();
            if (lineNo == 1 && line.startsWith("\uFEFF")) {
                line = line.substring(1).trim();
            }
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] cols = line.split(",", -1);
            String ticker = cols[0].trim();
            if (lineNo == 1 || out.isEmpty()) {
                if ("ticker".equals(ticker.toLowerCase(Locale.ROOT)) || "symbol".equals(ticker.toLowerCase(Locale.ROOT))) {
                    continue;
                }
            }
            if (ticker.isEmpty()) {
                LOG.warn("Universe line {} has no ticker, skipped", lineNo);
                continue;
            }
            String sector = cols.length > 1 ? cols[1].trim() : "";
            Symbol.AssetType type = Symbol.AssetType.fromText(cols.length > 2 ? cols[2].trim() : "");
            Symbol symbol = new Symbol(ticker, sector, type);
            if (type != Symbol.AssetType.EQUITY) {
                skippedNonEquity++;
                LOG.warn("Universe line {}: {} is {}, expected equities only; skipped", lineNo, symbol.ticker(), type);
                continue;
            }
            out.putIfAbsent(symbol.ticker(), symbol);
        }
        if (skippedNonEquity > 0) {
            LOG.warn("Universe: {} non-equity rows skipped", skippedNonEquity);
        }
        return new ArrayList<>(out.values());
    }
}
