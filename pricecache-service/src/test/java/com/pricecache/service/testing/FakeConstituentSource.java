package com.pricecache.service.testing;

import com.pricecache.service.universe.Constituent;
import com.pricecache.service.universe.ConstituentSource;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Constituent source serving a settable list, or failing on demand.
 */
public class FakeConstituentSource implements ConstituentSource {

    private volatile List<Constituent> constituents;
    private volatile IOException failure;
    private final AtomicInteger fetchCount = new AtomicInteger();

    public FakeConstituentSource(List<String> symbols) {
        setSymbols(symbols);
    }

    public void setSymbols(List<String> symbols) {
        this.constituents = symbols.stream().map(Constituent::of).toList();
    }

    public void setConstituents(List<Constituent> constituents) {
        this.constituents = constituents;
    }

    public void failWith(IOException failure) {
        this.failure = failure;
    }

    public int fetchCount() {
        return fetchCount.get();
    }

    @Override
    public List<Constituent> fetchConstituents() throws IOException {
        fetchCount.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
        return constituents;
    }

    @Override
    public String getName() {
        return "fake";
    }
}
