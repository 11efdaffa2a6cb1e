package com.macroallocator.common.universe;

import java.util.List;

/**
 * Built-in candidate universe. Every sector named by a regime tilt has at least two
 * members so that a filtered universe always offers a choice.
 */
public final class TickerCatalog {

    private TickerCatalog() {}

    public static final List<TickerDefinition> DEFAULT = List.of(
        // defensive
        new TickerDefinition("GLD",   "SPDR Gold Shares",                  "Gold"),
        new TickerDefinition("GDX",   "VanEck Gold Miners ETF",            "Gold"),
        new TickerDefinition("NEM",   "Newmont Corporation",               "Gold"),
        new TickerDefinition("XLU",   "Utilities Select Sector SPDR",      "Utilities"),
        new TickerDefinition("NEE",   "NextEra Energy",                    "Utilities"),
        new TickerDefinition("DUK",   "Duke Energy",                       "Utilities"),
        new TickerDefinition("TLT",   "iShares 20+ Year Treasury Bond",    "Bonds"),
        new TickerDefinition("IEF",   "iShares 7-10 Year Treasury Bond",   "Bonds"),
        new TickerDefinition("BND",   "Vanguard Total Bond Market",        "Bonds"),
        new TickerDefinition("KO",    "Coca-Cola",                         "Consumer Staples"),
        new TickerDefinition("PG",    "Procter & Gamble",                  "Consumer Staples"),
        new TickerDefinition("PEP",   "PepsiCo",                           "Consumer Staples"),
        new TickerDefinition("JNJ",   "Johnson & Johnson",                 "Healthcare"),
        new TickerDefinition("UNH",   "UnitedHealth Group",                "Healthcare"),
        new TickerDefinition("PFE",   "Pfizer",                            "Healthcare"),
        // aggressive
        new TickerDefinition("AAPL",  "Apple",                             "Technology"),
        new TickerDefinition("MSFT",  "Microsoft",                         "Technology"),
        new TickerDefinition("GOOGL", "Alphabet",                          "Technology"),
        new TickerDefinition("NVDA",  "NVIDIA",                            "Semiconductors"),
        new TickerDefinition("AMD",   "Advanced Micro Devices",            "Semiconductors"),
        new TickerDefinition("TSM",   "Taiwan Semiconductor",              "Semiconductors"),
        new TickerDefinition("COIN",  "Coinbase Global",                   "Crypto"),
        new TickerDefinition("MSTR",  "MicroStrategy",                     "Crypto"),
        new TickerDefinition("IBIT",  "iShares Bitcoin Trust",             "Crypto"),
        new TickerDefinition("TSLA",  "Tesla",                             "Growth"),
        new TickerDefinition("AMZN",  "Amazon",                            "Growth"),
        new TickerDefinition("META",  "Meta Platforms",                    "Growth"),
        // neutral
        new TickerDefinition("SPY",   "SPDR S&P 500 ETF",                  "Diversified"),
        new TickerDefinition("QQQ",   "Invesco QQQ Trust",                 "Diversified"),
        new TickerDefinition("DIA",   "SPDR Dow Jones Industrial Average", "Diversified"),
        new TickerDefinition("IWM",   "iShares Russell 2000",              "Diversified"),
        new TickerDefinition("JPM",   "JPMorgan Chase",                    "Financials"),
        new TickerDefinition("GS",    "Goldman Sachs",                     "Financials"),
        new TickerDefinition("XOM",   "Exxon Mobil",                       "Energy"),
        new TickerDefinition("CVX",   "Chevron",                           "Energy")
    );
}
