package com.chartbot.data.calendar;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a chart symbol to the currencies and economic-calendar country codes that move it.
 */
public final class SymbolResolver {
    private static final Map<String, String> CURRENCY_COUNTRY = Map.of(
            "EUR", "EU",
            "USD", "US",
            "GBP", "GB",
            "JPY", "JP",
            "CHF", "CH",
            "AUD", "AU",
            "CAD", "CA",
            "NZD", "NZ"
    );
    private static final List<String> COUNTRY_ORDER = List.of("EUR", "USD", "GBP", "JPY", "CHF", "AUD", "CAD", "NZD");

    private SymbolResolver() {
    }

    public enum AssetType {
        FOREX,
        CRYPTO,
        STOCK,
        COMMODITY
    }

    public record SymbolInfo(List<String> currencies, List<String> countries, AssetType assetType) {
    }

    /**
     * Resolves a symbol such as {@code EURUSD}, {@code FX:GBPJPY}, {@code BTCUSD} or {@code XAUUSD}.
     * Any exchange prefix before ':' is dropped; unrecognized symbols are treated as US stocks.
     */
    public static SymbolInfo resolve(String symbol) {
        String raw = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        int colon = raw.lastIndexOf(':');
        if (colon >= 0) {
            raw = raw.substring(colon + 1);
        }
        String sym = raw.replaceAll("[^A-Z]", "");

        if (sym.contains("BTC") || sym.contains("ETH") || sym.contains("LTC")) {
            String crypto = sym.substring(0, Math.min(3, sym.length()));
            String fiat = sym.length() > 3 ? sym.substring(3) : "";
            List<String> countries = fiat.equals("USD") ? List.of("US") : fiat.equals("EUR") ? List.of("EU") : List.of();
            return new SymbolInfo(List.of(crypto, fiat), countries, AssetType.CRYPTO);
        }

        if (sym.length() == 6 && !sym.startsWith("XAU") && !sym.startsWith("XAG")) {
            String base = sym.substring(0, 3);
            String quote = sym.substring(3);
            List<String> countries = new ArrayList<>();
            for (String currency : COUNTRY_ORDER) {
                if (currency.equals(base) || currency.equals(quote)) {
                    countries.add(CURRENCY_COUNTRY.get(currency));
                }
            }
            return new SymbolInfo(List.of(base, quote), List.copyOf(countries), AssetType.FOREX);
        }

        if (sym.startsWith("XAU") || sym.startsWith("XAG")) {
            String currency = sym.length() > 3 ? sym.substring(3) : "USD";
            List<String> countries = currency.equals("USD") ? List.of("US") : List.of();
            return new SymbolInfo(List.of(currency), countries, AssetType.COMMODITY);
        }

        return new SymbolInfo(List.of("USD"), List.of("US"), AssetType.STOCK);
    }
}
