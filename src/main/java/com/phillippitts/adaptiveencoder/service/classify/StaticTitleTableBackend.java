package com.phillippitts.adaptiveencoder.service.classify;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Offline {@link SearchBackend} answering from a fixed table of well-known titles.
 * Unknown titles yield a neutral snippet with no indicator keywords.
 */
@Component
public class StaticTitleTableBackend implements SearchBackend {

    private static final List<Entry> TABLE = List.of(
            new Entry("interstellar|gravity|inception|blade.*runner|matrix|avatar",
                    "%s is a live-action science fiction film starring actors directed by filmmaker cinematography"),
            new Entry("arcane|spirited.*away|your.*name|akira|princess.*mononoke",
                    "%s is an anime animated film japanese animation studio production"),
            new Entry("toy.*story|shrek|frozen|moana|incredibles|finding.*nemo",
                    "%s is a 3D animation computer animated film pixar dreamworks cgi rendered"),
            new Entry("john.*wick|fast.*furious|mission.*impossible|expendables",
                    "%s is an action film live-action thriller adventure starring actors"));

    @Override
    public List<String> search(String query, String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        for (Entry e : TABLE) {
            if (e.pattern().matcher(lower).find()) {
                return List.of(String.format(Locale.ROOT, e.snippet(), title));
            }
        }
        return List.of(title + " movie film content information");
    }

    private record Entry(Pattern pattern, String snippet) {
        Entry(String regex, String snippet) {
            this(Pattern.compile(regex), snippet);
        }
    }
}
