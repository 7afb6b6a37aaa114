package io.engram.core.memory;

import io.engram.core.memory.ClassificationRule.Target;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

public final class MemoryTypeClassifier {
    public static final List<ClassificationRule> DEFAULT_RULES = List.of(
        new ClassificationRule(1, Target.CONTENT,
            List.of("prefer", "like", "hate", "love", "dislike", "values", "style"), MemoryType.PREFERENCES),
        new ClassificationRule(2, Target.CONTENT,
            List.of("decided", "decision", "chose", "will use", "strategy"), MemoryType.DECISIONS),
        new ClassificationRule(3, Target.CONTENT,
            List.of("built", "created", "today", "yesterday", "happened", "did"), MemoryType.EXPERIENCES),
        new ClassificationRule(4, Target.CONTENT,
            List.of("how to", "guide", "tutorial", "steps to", "method"), MemoryType.SKILLS),
        new ClassificationRule(5, Target.TAGS,
            List.of("project", "system", "overview", "about"), MemoryType.CONTEXT)
    );

    private final List<ClassificationRule> rules;
    private final MemoryType fallback;

    public MemoryTypeClassifier() {
        this(DEFAULT_RULES, MemoryType.FACTS);
    }

    public MemoryTypeClassifier(List<ClassificationRule> rules, MemoryType fallback) {
        this.rules = rules.stream()
            .sorted(Comparator.comparingInt(ClassificationRule::priority))
            .toList();
        this.fallback = fallback == null ? MemoryType.FACTS : fallback;
    }

    public MemoryType classify(String content, List<String> tags) {
        String loweredContent = content == null ? "" : content.toLowerCase(Locale.ROOT);
        String loweredTags = tags == null ? "" : String.join(" ", tags).toLowerCase(Locale.ROOT);
        for (ClassificationRule rule : rules) {
            if (rule.matches(loweredContent, loweredTags)) {
                return rule.label();
            }
        }
        return fallback;
    }

    public List<ClassificationRule> rules() {
        return rules;
    }
}
