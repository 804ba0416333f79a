package io.github.drompincen.remedyguard.runtime.classify;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Flags recommendation text containing a destructive verb. Matching is case-insensitive
 * on whole tokens (runs of letters and digits), so punctuation around a verb does not
 * hide it.
 *
 * <p>Known gaps: inflections ("deleted", "killing"), synonyms ("wipe", "purge",
 * "rm -rf") and other languages are not flagged. A miss sends a destructive action
 * through without confirmation, so extend the term list rather than relying on it.
 */
@Component
public class DestructiveClassifier {

    public static final Set<String> DEFAULT_TERMS = Set.of("delete", "remove", "kill", "uninstall", "erase");

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final Set<String> terms;

    @Autowired
    public DestructiveClassifier(
            @Value("${remedyguard.classifier.terms:delete,remove,kill,uninstall,erase}") Collection<String> terms) {
        Set<String> normalized = terms == null ? Set.of() : terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.terms = normalized.isEmpty() ? DEFAULT_TERMS : normalized;
    }

    public static DestructiveClassifier withDefaultTerms() {
        return new DestructiveClassifier(DEFAULT_TERMS);
    }

    public boolean isDestructive(String recommendation) {
        if (recommendation == null || recommendation.isBlank()) return false;
        for (String token : TOKEN_SEPARATOR.split(recommendation.toLowerCase(Locale.ROOT))) {
            if (terms.contains(token)) return true;
        }
        return false;
    }

    public Set<String> terms() {
        return terms;
    }
}
