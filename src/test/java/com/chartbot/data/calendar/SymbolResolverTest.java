package com.chartbot.data.calendar;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SymbolResolverTest {

    @Test
    void resolve_shouldMapForexPairToBothCountries() {
        SymbolResolver.SymbolInfo info = SymbolResolver.resolve("FX:GBPJPY");

        assertEquals(SymbolResolver.AssetType.FOREX, info.assetType());
        assertEquals(List.of("GBP", "JPY"), info.currencies());
        assertEquals(List.of("GB", "JP"), info.countries());
    }

    @Test
    void resolve_shouldOrderCountriesByMajorCurrency() {
        assertEquals(List.of("EU", "US"), SymbolResolver.resolve("usdeur").countries());
    }

    @Test
    void resolve_shouldRecognizeCryptoCommodityAndStock() {
        SymbolResolver.SymbolInfo crypto = SymbolResolver.resolve("BINANCE:BTCUSD");
        assertEquals(SymbolResolver.AssetType.CRYPTO, crypto.assetType());
        assertEquals(List.of("US"), crypto.countries());

        SymbolResolver.SymbolInfo gold = SymbolResolver.resolve("OANDA:XAUUSD");
        assertEquals(SymbolResolver.AssetType.COMMODITY, gold.assetType());
        assertEquals(List.of("US"), gold.countries());

        SymbolResolver.SymbolInfo stock = SymbolResolver.resolve("NASDAQ:AAPL");
        assertEquals(SymbolResolver.AssetType.STOCK, stock.assetType());
        assertEquals(List.of("US"), stock.countries());
    }

    @Test
    void resolve_shouldGiveNoCountriesForUnmappedCryptoQuote() {
        assertEquals(List.of(), SymbolResolver.resolve("ETHBTC").countries());
    }
}
