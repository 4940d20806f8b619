package br.edu.ifba.journal.nlu;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.journal.core.EntityType;
import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.ExtractedFact.Mention;
import br.edu.ifba.journal.core.IntentLabel;
import br.edu.ifba.journal.core.Turn;

/**
 * Offline entity tagger used when generative extraction cannot be used.
 *
 * <p>Finds runs of capitalised words and classifies each run coarsely:</p>
 * <ul>
 *   <li>ORGANIZATION when the run ends with a corporate or institutional suffix</li>
 *   <li>PLACE when the run is in the gazetteer or follows a locative preposition</li>
 *   <li>PERSON otherwise</li>
 * </ul>
 *
 * <p>Never produces emotions or relationships, and always reports {@link IntentLabel#GENERAL}.
 * Deterministic: the same text always yields the same fact.</p>
 */
public class LexicalEntityTagger implements ExtractionStrategy {

    public static final String NAME = "lexical";

    private static final Pattern CAPITALISED_RUN =
        Pattern.compile("\\b\\p{Lu}[\\p{L}'&-]*(?:\\s+(?:of\\s+)?\\p{Lu}[\\p{L}'&-]*)*");

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s*$");

    private static final Set<String> ORGANIZATION_SUFFIXES = Set.of(
        "inc", "corp", "corporation", "llc", "ltd", "co", "company", "group", "bank", "university",
        "college", "school", "hospital", "labs", "technologies", "systems", "foundation", "institute",
        "agency", "studio", "studios"
    );

    private static final Set<String> GAZETTEER = Set.of(
        "london", "paris", "berlin", "tokyo", "new york", "los angeles", "san francisco", "chicago",
        "boston", "seattle", "toronto", "sydney", "madrid", "lisbon", "rome", "dublin", "amsterdam",
        "salvador", "bahia", "brazil", "portugal", "spain", "france", "germany", "italy", "japan",
        "canada", "mexico", "india", "china", "england", "ireland", "australia", "europe", "asia",
        "africa", "california", "texas", "florida"
    );

    private static final Set<String> LOCATIVE_PREPOSITIONS = Set.of(
        "in", "to", "from", "near", "around", "visiting", "visited", "across"
    );

    // capitalised only because of grammar or calendar
    private static final Set<String> STOPWORDS = Set.of(
        "i", "i'm", "i've", "i'd", "i'll", "the", "a", "an", "my", "we", "he", "she", "they", "it",
        "this", "that", "these", "those", "today", "yesterday", "tomorrow", "tonight", "but", "and",
        "so", "then", "when", "what", "why", "how", "where", "who", "maybe", "also", "just", "after",
        "before", "because", "if", "hello", "hi", "hey", "thanks", "ok", "okay", "yes", "no",
        "you", "your", "our", "his", "her", "their", "me", "there", "here", "now", "still", "really",
        "never", "always", "sometimes", "went", "got", "had", "felt", "feel", "was", "is", "lately",
        "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
        "january", "february", "march", "april", "may", "june", "july", "august", "september",
        "october", "november", "december", "mom", "dad"
    );

    @Override
    @NotNull
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    @NotNull
    public CompletableFuture<ExtractedFact> extract(@NotNull String text, @NotNull List<Turn> recentHistory) {
        return CompletableFuture.completedFuture(tag(text));
    }

    /**
     * Tags the text synchronously.
     */
    @NotNull
    public ExtractedFact tag(@NotNull String text) {
        Map<String, Mention> mentions = new LinkedHashMap<>();
        Matcher matcher = CAPITALISED_RUN.matcher(text);
        while (matcher.find()) {
            List<String> words = trimStopwords(matcher.group().split("\\s+"));
            if (words.isEmpty()) {
                continue;
            }
            String preceding = precedingWord(text, matcher.start());
            if (words.size() == 1 && preceding.isEmpty() && looksLikeSentenceOpener(words.get(0))) {
                continue;
            }
            String name = String.join(" ", words);
            String key = name.toLowerCase(Locale.ROOT);
            if (!mentions.containsKey(key)) {
                mentions.put(key, new Mention(name, classify(name, words, preceding)));
            }
        }
        return new ExtractedFact(new ArrayList<>(mentions.values()), List.of(), List.of(), IntentLabel.GENERAL, NAME);
    }

    private EntityType classify(String name, List<String> words, String precedingWord) {
        String last = words.get(words.size() - 1).toLowerCase(Locale.ROOT).replace(".", "");
        if (ORGANIZATION_SUFFIXES.contains(last) || "university".equalsIgnoreCase(words.get(0))) {
            return EntityType.ORGANIZATION;
        }
        if (GAZETTEER.contains(name.toLowerCase(Locale.ROOT))
            || LOCATIVE_PREPOSITIONS.contains(precedingWord)) {
            return EntityType.PLACE;
        }
        return EntityType.PERSON;
    }

    private static List<String> trimStopwords(String[] run) {
        List<String> words = new ArrayList<>(List.of(run));
        while (!words.isEmpty() && isStopword(words.get(0))) {
            words.remove(0);
        }
        while (!words.isEmpty() && isStopword(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        // a dangling "of" is left when the trailing word was a stopword
        if (!words.isEmpty() && "of".equals(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        return words;
    }

    private static boolean isStopword(String word) {
        return STOPWORDS.contains(word.toLowerCase(Locale.ROOT).replace('’', '\''));
    }

    /**
     * Single capitalised words opening a sentence are usually verbs or adverbs, not names.
     */
    private static boolean looksLikeSentenceOpener(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return !GAZETTEER.contains(lower)
            && (lower.endsWith("ed") || lower.endsWith("ing") || lower.endsWith("ly"));
    }

    private static String precedingWord(String text, int start) {
        String before = text.substring(0, start).stripTrailing();
        if (before.isEmpty() || SENTENCE_END.matcher(before).find()) {
            return "";
        }
        int space = before.lastIndexOf(' ');
        String word = space < 0 ? before : before.substring(space + 1);
        return word.toLowerCase(Locale.ROOT);
    }
}
