package com.pricecache.service.universe;

import com.pricecache.service.data.HttpClientFactory;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * S&P 500 constituents scraped from the Wikipedia list page.
 * The symbol, company and sector columns are located by header text.
 */
public class WikipediaConstituentSource implements ConstituentSource {

    private static final Logger log = LoggerFactory.getLogger(WikipediaConstituentSource.class);

    public static final String DEFAULT_URL = "https://en.wikipedia.org/wiki/List_of_S%26P_500_companies";
    private static final String USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final OkHttpClient httpClient;
    private final String url;

    public WikipediaConstituentSource() {
        this(HttpClientFactory.getClient(), DEFAULT_URL);
    }

    public WikipediaConstituentSource(OkHttpClient httpClient, String url) {
        this.httpClient = httpClient;
        this.url = url;
    }

    @Override
    public List<Constituent> fetchConstituents() throws IOException {
        log.info("Fetching constituents from {}", url);

        Request request = new Request.Builder()
            .url(url)
            .header("User-Agent", USER_AGENT)
            .get()
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Wikipedia returned HTTP " + response.code());
            }
            String html = response.body() != null ? response.body().string() : "";
            List<Constituent> constituents = parse(html);
            log.info("Fetched {} constituents from Wikipedia", constituents.size());
            return constituents;
        }
    }

    @Override
    public String getName() {
        return "wikipedia";
    }

    /**
     * Parse the first constituent table of the page.
     */
    static List<Constituent> parse(String html) {
        Document doc = Jsoup.parse(html);
        Element table = doc.selectFirst("table#constituents");
        if (table == null) {
            table = doc.selectFirst("table");
        }
        if (table == null) {
            return List.of();
        }

        Elements rows = table.select("tr");
        if (rows.isEmpty()) {
            return List.of();
        }

        Elements headers = rows.get(0).select("th");
        int symbolCol = -1;
        int nameCol = -1;
        int sectorCol = -1;
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i).text().toLowerCase(Locale.ROOT);
            if (symbolCol < 0 && (header.contains("symbol") || header.contains("ticker"))) {
                symbolCol = i;
            } else if (nameCol < 0 && (header.contains("security") || header.contains("company")
                    || header.contains("name"))) {
                nameCol = i;
            } else if (sectorCol < 0 && header.contains("sector")) {
                sectorCol = i;
            }
        }
        if (symbolCol < 0) {
            log.warn("Could not find symbol column, using the first column");
            symbolCol = 0;
        }

        List<Constituent> constituents = new ArrayList<>();
        for (int r = 1; r < rows.size(); r++) {
            Elements cells = rows.get(r).select("td");
            if (cells.size() <= symbolCol) {
                continue;
            }
            // Footnote markers like "XYZ[3]" are stripped
            String symbol = cells.get(symbolCol).text().split("\\[")[0].trim().toUpperCase(Locale.ROOT);
            if (symbol.isEmpty()) {
                continue;
            }
            constituents.add(new Constituent(symbol, cellText(cells, nameCol), cellText(cells, sectorCol)));
        }
        return constituents;
    }

    private static String cellText(Elements cells, int index) {
        if (index < 0 || index >= cells.size()) {
            return null;
        }
        String text = cells.get(index).text().trim();
        return text.isEmpty() ? null : text;
    }
}
