package com.pricecache.service.universe;

import java.io.IOException;
import java.util.List;

/**
 * Where the current universe constituent list comes from.
 */
public interface ConstituentSource {

    List<Constituent> fetchConstituents() throws IOException;

    /**
     * Short name recorded with the cached list, e.g. "wikipedia".
     */
    String getName();
}
