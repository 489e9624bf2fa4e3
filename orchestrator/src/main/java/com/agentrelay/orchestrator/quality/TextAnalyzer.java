package com.agentrelay.orchestrator.quality;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.agentrelay.orchestrator.quality.QualityPatterns.*;

/**
 * Extracts {@link TextFeatures} from raw content. Pure and thread-safe.
 */
@Component
public class TextAnalyzer {

    private static final Pattern WORD = Pattern.compile("[a-z0-9$%][a-z0-9$%.,'\\-]*");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9 ]");

    private static final List<Pattern> GENERIC_PATTERNS = GENERIC_PHRASES.stream()
            .map(p -> Pattern.compile("\\b" + Pattern.quote(p) + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    public TextFeatures analyze(String content) {
        String text  = content == null ? "" : content.strip();
        String lower = text.toLowerCase(Locale.ROOT);

        List<String> words     = words(lower);
        List<String> sentences = sentences(text);

        List<String> generic = new ArrayList<>();
        for (int i = 0; i < GENERIC_PATTERNS.size(); i++) {
            Matcher m = GENERIC_PATTERNS.get(i).matcher(text);
            while (m.find()) generic.add(GENERIC_PHRASES.get(i));
        }

        Set<String> technical = new HashSet<>();
        for (String w : words) {
            if (TECHNICAL_TERMS.contains(w)) technical.add(w);
        }

        return new TextFeatures(
                text,
                lower,
                words,
                sentences,
                count(NUMBER, text),
                count(UNIT_VALUE, text),
                count(PERCENTAGE, text),
                count(CURRENCY, text),
                COMPARISON.matcher(text).find(),
                technical.size(),
                count(ACTION_VERB, text),
                count(HEDGE, text),
                count(VAGUE, text),
                List.copyOf(generic),
                count(STEP_MARKER, text),
                CODE_OR_COMMAND.matcher(text).find(),
                count(METHOD_CONNECTOR, text),
                isCircular(sentences),
                hallucinationRisk(text),
                redundancy(sentences, words));
    }

    // ------------------------------------------------------------------
    // Tokenisation
    // ------------------------------------------------------------------

    private static List<String> words(String lower) {
        List<String> out = new ArrayList<>();
        Matcher m = WORD.matcher(lower);
        while (m.find()) {
            String w = m.group();
            int end = w.length();
            while (end > 0 && ".,'-".indexOf(w.charAt(end - 1)) >= 0) end--;
            if (end > 0) out.add(w.substring(0, end));
        }
        return out;
    }

    private static List<String> sentences(String text) {
        if (text.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        for (String s : SENTENCE_BREAK.split(text)) {
            String t = s.strip();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    // ------------------------------------------------------------------
    // Negative indicators
    // ------------------------------------------------------------------

    /**
     * A sentence is circular when the clause after "because"/"since"/"due to"
     * mostly repeats the content words of the clause before it.
     */
    static boolean isCircular(List<String> sentences) {
        for (String sentence : sentences) {
            String[] parts = CAUSAL_SPLIT.split(sentence.toLowerCase(Locale.ROOT), 2);
            if (parts.length < 2) continue;
            Set<String> left  = stems(parts[0]);
            Set<String> right = stems(parts[1]);
            if (right.size() < 2) continue;
            long shared = right.stream().filter(left::contains).count();
            if ((double) shared / right.size() >= 0.6) return true;
        }
        return false;
    }

    private static Set<String> stems(String clause) {
        Set<String> out = new LinkedHashSet<>();
        for (String w : words(clause)) {
            if (w.length() <= 3 || STOPWORDS.contains(w)) continue;
            out.add(w.length() > 5 ? w.substring(0, 5) : w);
        }
        return out;
    }

    static double hallucinationRisk(String text) {
        double risk = 0.3 * count(ABSOLUTE_CLAIM, text)
                    + 0.2 * count(OVERPRECISE_NUMBER, text)
                    + 0.4 * count(IMPOSSIBLE_REDUCTION, text);
        return Math.min(1.0, risk);
    }

    /**
     * Larger of the duplicate-sentence ratio and the repeated-trigram ratio.
     */
    static double redundancy(List<String> sentences, List<String> words) {
        double sentenceRatio = 0.0;
        if (sentences.size() > 1) {
            Set<String> distinct = new HashSet<>();
            for (String s : sentences) {
                distinct.add(NON_ALNUM.matcher(s.toLowerCase(Locale.ROOT)).replaceAll("").trim());
            }
            sentenceRatio = 1.0 - (double) distinct.size() / sentences.size();
        }
        double trigramRatio = 0.0;
        if (words.size() >= 6) {
            int total = words.size() - 2;
            Set<String> distinct = new HashSet<>();
            for (int i = 0; i < total; i++) {
                distinct.add(words.get(i) + ' ' + words.get(i + 1) + ' ' + words.get(i + 2));
            }
            trigramRatio = (double) (total - distinct.size()) / total;
        }
        return Math.max(sentenceRatio, trigramRatio);
    }
}
