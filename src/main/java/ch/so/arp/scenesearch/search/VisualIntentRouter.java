package ch.so.arp.scenesearch.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides from the query text whether the visual channel should drive
 * retrieval ({@link VisualMode#RECALL}), only reorder the base ranking
 * ({@link VisualMode#RERANK}) or be ignored ({@link VisualMode#SKIP}).
 * <p>
 * Classification is a lookup of the query tokens in a keyword table:
 * <ul>
 * <li>any speech term wins and yields SKIP,</li>
 * <li>matches from two strong visual categories (color, object, action), or a
 * single object or action category that is not outnumbered by the other
 * content words, yield RECALL,</li>
 * <li>everything else, including queries without any match, yields RERANK.</li>
 * </ul>
 * The router is stateless and never throws.
 */
public class VisualIntentRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(VisualIntentRouter.class);

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}-]+");

    private static final Pattern QUOTED = Pattern.compile("[\"“”„«»「」]");

    private static final int MAX_PHRASE_LENGTH = 3;

    private static final Map<String, TermCategory> LEXICON = new LexiconBuilder()
            .add(TermCategory.SPEECH, "says", "said", "say", "saying", "mentions", "mentioned", "mention",
                    "discusses", "discussed", "explains", "explained", "quote", "quotes", "quoted", "line", "lines",
                    "dialogue", "dialog", "conversation", "tells", "told", "asks", "asked", "answers", "answered",
                    "announces", "announced", "declares", "declared", "words", "phrase", "sentence", "spoken",
                    "verbal", "talks about", "talked about", "talking about", "the part where", "the line where")
            .add(TermCategory.COLOR, "red", "blue", "green", "yellow", "orange", "purple", "pink", "brown", "black",
                    "white", "gray", "grey", "golden", "silver", "colorful")
            .add(TermCategory.OBJECT, "person", "people", "man", "men", "woman", "women", "child", "children", "kid",
                    "face", "hand", "hands", "car", "cars", "vehicle", "truck", "bus", "bike", "bicycle",
                    "motorcycle", "building", "house", "room", "door", "window", "wall", "sign", "logo", "banner",
                    "poster", "plate", "cup", "bottle", "table", "chair", "tree", "trees", "flower", "flowers", "sky",
                    "water", "mountain", "beach", "animal", "dog", "cat", "bird", "horse", "phone", "computer",
                    "laptop", "screen", "camera", "book", "clothes", "shirt", "dress", "hat", "shoes", "jacket",
                    "umbrella", "crowd", "audience", "ball", "guitar")
            .add(TermCategory.ACTION, "walking", "running", "sitting", "standing", "jumping", "dancing", "talking",
                    "speaking", "laughing", "crying", "smiling", "eating", "drinking", "cooking", "driving", "riding",
                    "flying", "swimming", "climbing", "waving", "pointing", "holding", "hugging", "kissing",
                    "fighting", "clapping", "singing", "playing", "opening", "closing", "entering", "leaving")
            .add(TermCategory.FOOD, "tteokbokki", "떡볶이", "kimchi", "김치", "bibimbap",
                    "비빔밥", "bulgogi", "불고기", "samgyeopsal", "삼겹살",
                    "chicken", "치킨", "pizza", "noodles", "ramen", "food", "coffee", "cake")
            .add(TermCategory.SHOT, "scene", "scenes", "shot", "angle", "view", "frame", "background", "foreground",
                    "close-up", "closeup", "wide", "zoom", "zoomed", "indoor", "outdoor", "day", "night", "sunset",
                    "sunrise", "bright", "dark", "blurry", "wearing", "looks like", "dressed in", "footage of",
                    "clip of", "show me")
            .build();

    private static final Set<String> STOPWORDS = Set.of("a", "an", "the", "of", "in", "on", "at", "with", "and",
            "or", "to", "for", "from", "by", "is", "are", "was", "were", "be", "it", "its", "this", "that", "these",
            "those", "some", "any", "me", "my", "his", "her", "their", "our", "he", "she", "they", "we", "i", "you",
            "find", "where", "when", "who", "what", "which", "about", "into", "over", "near", "while", "as", "like");

    /**
     * @param queryText     the raw query, may be {@code null}
     * @param configuredMode configured mode, anything but {@code AUTO} is
     *                       returned unchanged
     */
    public RoutingDecision route(String queryText, VisualModeSetting configuredMode) {
        if (configuredMode != null && configuredMode.forcedMode().isPresent()) {
            return RoutingDecision.forced(configuredMode.forcedMode().get());
        }
        if (queryText == null || queryText.isBlank()) {
            return RoutingDecision.classified(VisualMode.SKIP, "empty query", List.of());
        }

        List<String> tokens = tokenize(queryText);
        boolean[] covered = new boolean[tokens.size()];
        List<Match> matches = new ArrayList<>();
        for (int length = MAX_PHRASE_LENGTH; length >= 1; length--) {
            for (int start = 0; start + length <= tokens.size(); start++) {
                if (isCovered(covered, start, length)) {
                    continue;
                }
                String candidate = String.join(" ", tokens.subList(start, start + length));
                TermCategory category = LEXICON.get(candidate);
                if (category != null) {
                    matches.add(new Match(candidate, category, length));
                    for (int i = start; i < start + length; i++) {
                        covered[i] = true;
                    }
                }
            }
        }
        if (QUOTED.matcher(queryText).find()) {
            matches.add(new Match("quoted text", TermCategory.SPEECH, 0));
        }

        RoutingDecision decision = classify(matches, countUnmatchedContent(tokens, covered));
        LOGGER.debug("Routed query '{}' to {} ({}), matches={}", abbreviate(queryText), decision.mode(),
                decision.reason(), decision.matchedTerms());
        return decision;
    }

    private RoutingDecision classify(List<Match> matches, int unmatchedContent) {
        List<String> terms = matches.stream().map(Match::describe).toList();
        List<String> speech = matches.stream()
                .filter(match -> match.category() == TermCategory.SPEECH)
                .map(Match::term)
                .toList();
        if (!speech.isEmpty()) {
            return RoutingDecision.classified(VisualMode.SKIP, String.join(", ", speech), terms);
        }

        List<Match> visual = matches.stream().filter(match -> match.category().isVisual()).toList();
        if (visual.isEmpty()) {
            return RoutingDecision.classified(VisualMode.RERANK, "no visual or speech terms", terms);
        }

        Set<TermCategory> strongCategories = EnumSet.noneOf(TermCategory.class);
        visual.stream().map(Match::category).filter(TermCategory::isStrong).forEach(strongCategories::add);
        int visualTokens = visual.stream().mapToInt(Match::tokens).sum();
        boolean strong = strongCategories.size() >= 2
                || (strongCategories.size() == 1 && !strongCategories.contains(TermCategory.COLOR)
                        && visualTokens >= unmatchedContent);
        if (strong) {
            return RoutingDecision.classified(VisualMode.RECALL, "strong visual intent: " + String.join(", ", terms),
                    terms);
        }
        return RoutingDecision.classified(VisualMode.RERANK, "weak visual intent: " + String.join(", ", terms),
                terms);
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String raw : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            String token = stripHyphens(raw);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Tokens of the text without stopwords, used for keyword overlap.
     */
    static List<String> contentTokens(String text) {
        return tokenize(text).stream().filter(token -> !STOPWORDS.contains(token)).toList();
    }

    private static String stripHyphens(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '-') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '-') {
            end--;
        }
        return token.substring(start, end);
    }

    private static boolean isCovered(boolean[] covered, int start, int length) {
        for (int i = start; i < start + length; i++) {
            if (covered[i]) {
                return true;
            }
        }
        return false;
    }

    private static int countUnmatchedContent(List<String> tokens, boolean[] covered) {
        int count = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (!covered[i] && !STOPWORDS.contains(tokens.get(i))) {
                count++;
            }
        }
        return count;
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }

    private record Match(String term, TermCategory category, int tokens) {

        String describe() {
            return category.name().toLowerCase(Locale.ROOT) + ":" + term;
        }
    }

    private static final class LexiconBuilder {

        private final Map<String, TermCategory> entries = new HashMap<>();

        LexiconBuilder add(TermCategory category, String... terms) {
            for (String term : terms) {
                TermCategory previous = entries.putIfAbsent(term, category);
                if (previous != null) {
                    throw new IllegalStateException(
                            "term '" + term + "' listed as " + previous + " and " + category);
                }
            }
            return this;
        }

        Map<String, TermCategory> build() {
            return Collections.unmodifiableMap(entries);
        }
    }
}
