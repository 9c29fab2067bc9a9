package com.pricecache.service.universe;

/**
 * One member of the symbol universe.
 */
public record Constituent(String symbol, String companyName, String sector) {

    public static Constituent of(String symbol) {
        return new Constituent(symbol, null, null);
    }
}
