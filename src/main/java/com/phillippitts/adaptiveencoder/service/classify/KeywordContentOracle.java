package com.phillippitts.adaptiveencoder.service.classify;

import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.OracleVerdict;
import com.phillippitts.adaptiveencoder.exception.ClassificationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ContentOracle} that scores indicator keywords in search results.
 *
 * <p>Weights: anime x10, 3D animation x10, live action x8, action x6. Live action resolves to
 * {@code action} when the action score exceeds half the live-action score, else {@code film}.
 * Confidence is {@code max * 100 / (total + 1)} clamped to [20, 85], or 10 without indicators.
 */
@Component
public class KeywordContentOracle implements ContentOracle {

    private static final Logger LOG = LogManager.getLogger(KeywordContentOracle.class);

    private static final Pattern ANIME = Pattern.compile(
            "anime|manga|japanese animation|crunchyroll|funimation|2d animation");
    private static final Pattern ANIMATION_3D = Pattern.compile(
            "3d animation|computer animation|cgi|pixar|dreamworks|computer-generated|rendered");
    private static final Pattern LIVE_ACTION = Pattern.compile(
            "live-action|actor|actress|director|cast|filming|cinematography|starring");
    private static final Pattern ACTION = Pattern.compile(
            "action|thriller|adventure|superhero|martial arts|explosions");

    static final int MAX_QUERIES = 3;
    static final int NO_INDICATOR_CONFIDENCE = 10;

    private final SearchBackend backend;

    public KeywordContentOracle(SearchBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    @Override
    public OracleVerdict classify(String title, Integer year, boolean series) {
        StringBuilder results = new StringBuilder();
        List<String> queries = queries(title, year, series);
        for (int i = 0; i < Math.min(MAX_QUERIES, queries.size()); i++) {
            LOG.debug("Searching: {}", queries.get(i));
            for (String snippet : backend.search(queries.get(i), title)) {
                results.append(snippet).append('\n');
            }
        }
        if (results.length() == 0) {
            throw new ClassificationException("No search results for '" + title + "'");
        }
        return score(results.toString());
    }

    /**
     * Scores indicator keywords in aggregated search text. Package-private for tests.
     */
    static OracleVerdict score(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int anime = count(ANIME, lower) * 10;
        int animation3d = count(ANIMATION_3D, lower) * 10;
        int live = count(LIVE_ACTION, lower) * 8;
        int action = count(ACTION, lower) * 6;
        int total = anime + animation3d + live + action;
        LOG.debug("Keyword scores: anime={}, 3d={}, live={}, action={}", anime, animation3d, live, action);

        ContentType type = null;
        int max = 0;
        if (anime > max) {
            max = anime;
            type = ContentType.ANIME;
        }
        if (animation3d > max) {
            max = animation3d;
            type = ContentType.ANIMATION_3D;
        }
        if (live > max) {
            max = live;
            type = action > live / 2 ? ContentType.ACTION : ContentType.FILM;
        }
        if (type == null) {
            return new OracleVerdict(null, NO_INDICATOR_CONFIDENCE);
        }
        int confidence = Math.max(20, Math.min(85, max * 100 / (total + 1)));
        return OracleVerdict.of(type, confidence);
    }

    private static List<String> queries(String title, Integer year, boolean series) {
        List<String> queries = new ArrayList<>();
        if (series) {
            queries.add("\"" + title + "\" TV series anime OR animation OR live-action");
            queries.add(title + " television show animated OR live-action");
        } else if (year != null) {
            queries.add("\"" + title + "\" " + year + " movie anime OR animation OR live-action OR documentary");
            queries.add("\"" + title + "\" " + year + " film animated OR live-action OR CGI");
        } else {
            queries.add("\"" + title + "\" movie anime OR animation OR live-action");
            queries.add("\"" + title + "\" film animated OR live-action");
        }
        return queries;
    }

    private static int count(Pattern p, String text) {
        Matcher m = p.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }
}
