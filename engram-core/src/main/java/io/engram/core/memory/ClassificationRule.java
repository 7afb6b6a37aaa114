package io.engram.core.memory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public record ClassificationRule(int priority, Target target, List<String> keywords, MemoryType label) {

    public enum Target {
        CONTENT,
        TAGS
    }

    public ClassificationRule {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(label, "label must not be null");
        keywords = keywords == null ? List.of() : keywords.stream()
            .map(keyword -> keyword.toLowerCase(Locale.ROOT))
            .toList();
    }

    public boolean matches(String loweredContent, String loweredTags) {
        String haystack = target == Target.CONTENT ? loweredContent : loweredTags;
        for (String keyword : keywords) {
            if (haystack.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
