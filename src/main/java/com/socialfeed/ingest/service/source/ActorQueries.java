package com.socialfeed.ingest.service.source;

import com.socialfeed.ingest.model.ActorQuery;
import com.socialfeed.ingest.model.IngestWindow;
import com.socialfeed.ingest.model.QueryMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for actor run inputs.
 */
public final class ActorQueries {

    public static final String SORT_LATEST = "Latest";

    private ActorQueries() {
    }

    /**
     * {@code from:<id> since:<start> until:<until>} with the optional extra token appended.
     * {@code until} is exclusive.
     */
    public static String searchTerm(String identifier, IngestWindow window, String extraQuery) {
        String term = "from:" + identifier
                + " since:" + window.startDate()
                + " until:" + window.untilDate();
        if (extraQuery != null && !extraQuery.isBlank()) {
            term = term + " " + extraQuery.trim();
        }
        return term;
    }

    /**
     * One search term per identifier, sorted latest-first and capped at {@code maxItems}.
     */
    public static ActorQuery searchTerms(List<String> identifiers, IngestWindow window, String extraQuery, int maxItems) {
        List<String> terms = new ArrayList<>();
        for (String identifier : identifiers) {
            terms.add(searchTerm(identifier, window, extraQuery));
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("searchTerms", terms);
        input.put("sort", SORT_LATEST);
        input.put("maxItems", maxItems);
        return new ActorQuery(QueryMode.SEARCH_TERMS, input);
    }
}
