package com.macroallocator.common.universe;

/** Static catalog entry: what to fetch and how to tag it. */
public record TickerDefinition(String symbol, String name, String sector) {}
