package com.podvalidation.backend.classification;

import com.podvalidation.backend.model.AlternativeType;
import com.podvalidation.backend.model.DocumentType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword-based document type detection over OCR text.
 * <p>
 * The result depends only on the text, the OCR confidence and the context passed in, apart from the
 * {@code classifiedAt} timestamp. Persistence and the manual override rule are handled by
 * {@code DocumentClassificationService}.
 */
public class DocumentClassifier {

    static final double FUZZY_WEIGHT_FACTOR = 0.7;
    static final int FUZZY_MIN_LENGTH = 6;
    static final int MAX_ALTERNATIVES = 3;

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9]+");
    private static final Pattern LETTERS_ONLY = Pattern.compile("[a-z]+");

    private final ClassificationSettings settings;
    private final List<CompiledProfile> profiles;

    public DocumentClassifier(ClassificationSettings settings) {
        this(settings, KeywordProfile.DEFAULTS);
    }

    public DocumentClassifier(ClassificationSettings settings, List<KeywordProfile> profiles) {
        this.settings = settings;
        this.profiles = profiles.stream().map(CompiledProfile::new).toList();
    }

    public ClassificationSettings getSettings() {
        return settings;
    }

    public AutomaticClassification classify(String rawText, Double ocrConfidence, ClassificationContext context) {
        Instant now = Instant.now();
        if (rawText == null || rawText.isBlank()) {
            return AutomaticClassification.unknown(now);
        }

        List<TypeScore> ranked = score(rawText);
        double threshold = settings.thresholdFor(ocrConfidence);

        Optional<TypeScore> winner = selectWinner(ranked, threshold);
        if (winner.isPresent()) {
            TypeScore best = winner.get();
            return new AutomaticClassification(
                    best.type(),
                    capForOcr(Math.max(toConfidence(best.score()), threshold), ocrConfidence),
                    alternatives(ranked, best.type()),
                    best.matchedKeywords(),
                    false,
                    now);
        }

        Optional<AutomaticClassification> inferred = inferFromContext(ranked, ocrConfidence, context, now);
        if (inferred.isPresent()) {
            return inferred.get();
        }

        TypeScore top = ranked.get(0);
        return new AutomaticClassification(
                DocumentType.UNKNOWN,
                capForOcr(toConfidence(top.score()), ocrConfidence),
                alternatives(ranked, DocumentType.UNKNOWN),
                List.of(),
                false,
                now);
    }

    /**
     * Scores every known type against the text, highest score first.
     */
    public List<TypeScore> score(String rawText) {
        String text = rawText == null ? "" : rawText.toLowerCase(Locale.ROOT);
        Set<String> tokens = new LinkedHashSet<>(List.of(TOKEN_SEPARATOR.split(text)));

        List<TypeScore> scores = new ArrayList<>();
        for (CompiledProfile profile : profiles) {
            scores.add(profile.score(text, tokens));
        }
        // stable sort keeps profile order on equal scores
        scores.sort(Comparator.comparingDouble(TypeScore::score).reversed());
        return scores;
    }

    public double toConfidence(double score) {
        return round(Math.min(100.0, score / settings.maxScore() * 100.0));
    }

    /**
     * Types whose confidence reaches the threshold are eligible. Among eligible types with exact
     * primary evidence the highest priority wins, then the highest score. Once some type is eligible,
     * an exact primary hit on a higher-priority type outranks it even below the threshold; such a
     * winner is reported at the threshold confidence.
     */
    private Optional<TypeScore> selectWinner(List<TypeScore> ranked, double threshold) {
        List<TypeScore> eligible = ranked.stream()
                .filter(score -> score.score() > 0 && toConfidence(score.score()) >= threshold)
                .toList();
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        List<TypeScore> candidates = eligible.stream()
                .filter(score -> score.primaryHits() > 0)
                .toList();
        if (candidates.isEmpty()) {
            candidates = eligible;
        }
        TypeScore best = candidates.get(0);
        for (TypeScore candidate : candidates) {
            if (candidate.priority() > best.priority()) {
                best = candidate;
            }
        }
        for (TypeScore explicit : ranked) {
            if (explicit.primaryHits() > 0 && explicit.priority() > best.priority()) {
                best = explicit;
            }
        }
        return Optional.of(best);
    }

    private Optional<AutomaticClassification> inferFromContext(List<TypeScore> ranked, Double ocrConfidence,
            ClassificationContext context, Instant now) {
        if (context == null || !context.known()) {
            return Optional.empty();
        }
        Set<DocumentType> present = EnumSet.noneOf(DocumentType.class);
        context.siblingTypes().stream()
                .filter(type -> type != null && type != DocumentType.UNKNOWN)
                .forEach(present::add);

        double confidence = capForOcr(settings.inferredConfidence(), ocrConfidence);

        for (TypeScore candidate : ranked) {
            if (candidate.score() > 0 && !present.contains(candidate.type())) {
                return Optional.of(new AutomaticClassification(candidate.type(), confidence,
                        alternatives(ranked, candidate.type()), candidate.matchedKeywords(), true, now));
            }
        }

        boolean otherUnresolved = context.siblingTypes().stream()
                .anyMatch(type -> type == null || type == DocumentType.UNKNOWN);
        if (present.containsAll(DocumentType.PALLET_DOCUMENTS)
                && !present.contains(DocumentType.SHIP_DOCUMENT)
                && !otherUnresolved) {
            return Optional.of(new AutomaticClassification(DocumentType.SHIP_DOCUMENT, confidence,
                    alternatives(ranked, DocumentType.SHIP_DOCUMENT), List.of(), true, now));
        }
        return Optional.empty();
    }

    private List<AlternativeType> alternatives(List<TypeScore> ranked, DocumentType chosen) {
        return ranked.stream()
                .filter(score -> score.type() != chosen && score.score() > 0)
                .limit(MAX_ALTERNATIVES)
                .map(score -> new AlternativeType(score.type(), toConfidence(score.score())))
                .toList();
    }

    private double capForOcr(double confidence, Double ocrConfidence) {
        if (settings.isBelowFloor(ocrConfidence)) {
            return Math.min(confidence, settings.lowOcrConfidenceCap());
        }
        return confidence;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static final class CompiledProfile {

        private final KeywordProfile profile;
        private final List<Pattern> primaryPatterns;
        private final List<Pattern> secondaryPatterns;

        CompiledProfile(KeywordProfile profile) {
            this.profile = profile;
            this.primaryPatterns = profile.primary().stream().map(CompiledProfile::compile).toList();
            this.secondaryPatterns = profile.secondary().stream().map(CompiledProfile::compile).toList();
        }

        TypeScore score(String text, Set<String> tokens) {
            List<String> matched = new ArrayList<>();
            double total = 0;
            int primaryHits = 0;

            for (int i = 0; i < primaryPatterns.size(); i++) {
                String keyword = profile.primary().get(i);
                if (primaryPatterns.get(i).matcher(text).find()) {
                    total += profile.primaryWeight();
                    primaryHits++;
                    matched.add(keyword);
                } else {
                    Optional<String> fuzzy = fuzzyMatch(keyword, tokens);
                    if (fuzzy.isPresent()) {
                        total += profile.primaryWeight() * FUZZY_WEIGHT_FACTOR;
                        matched.add(keyword + " (fuzzy: " + fuzzy.get() + ")");
                    }
                }
            }
            for (int i = 0; i < secondaryPatterns.size(); i++) {
                String keyword = profile.secondary().get(i);
                if (secondaryPatterns.get(i).matcher(text).find()) {
                    total += profile.secondaryWeight();
                    matched.add(keyword);
                } else {
                    Optional<String> fuzzy = fuzzyMatch(keyword, tokens);
                    if (fuzzy.isPresent()) {
                        total += profile.secondaryWeight() * FUZZY_WEIGHT_FACTOR;
                        matched.add(keyword + " (fuzzy: " + fuzzy.get() + ")");
                    }
                }
            }
            return new TypeScore(profile.type(), total, matched, primaryHits, profile.priority());
        }

        // OCR typically garbles a single character in longer words
        private static Optional<String> fuzzyMatch(String keyword, Set<String> tokens) {
            if (keyword.length() < FUZZY_MIN_LENGTH || !LETTERS_ONLY.matcher(keyword).matches()) {
                return Optional.empty();
            }
            for (String token : tokens) {
                if (token.length() >= FUZZY_MIN_LENGTH
                        && Math.abs(token.length() - keyword.length()) <= 1
                        && editDistance(token, keyword) == 1) {
                    return Optional.of(token);
                }
            }
            return Optional.empty();
        }

        private static Pattern compile(String keyword) {
            String[] words = keyword.toLowerCase(Locale.ROOT).trim().split("\\s+");
            StringBuilder regex = new StringBuilder("(?<![a-z0-9])");
            for (int i = 0; i < words.length; i++) {
                if (i > 0) {
                    regex.append("\\s+");
                }
                regex.append(Pattern.quote(words[i]));
            }
            regex.append("(?![a-z0-9])");
            return Pattern.compile(regex.toString());
        }
    }
}
