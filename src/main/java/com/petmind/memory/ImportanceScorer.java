package com.petmind.memory;

import com.petmind.shared.model.EventKinds;
import com.petmind.shared.model.EventPayload;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps an event to an importance score in [0, 1]: a per-kind base score plus
 * additive content boosts. Pure and deterministic.
 */
public class ImportanceScorer {

    static final double DEFAULT_BASE = 0.4;

    private static final Map<String, Double> BASE_SCORES = Map.of(
            EventKinds.CHAT, 0.9,
            EventKinds.PREFERENCE, 0.9,
            EventKinds.SKILL, 0.8,
            EventKinds.VISION, 0.6,
            EventKinds.LOCATION, 0.5,
            EventKinds.INVENTORY, 0.4,
            EventKinds.APP_ACTIVITY, 0.3
    );

    private static final List<String> EMPHATIC_WORDS = List.of(
            "remember", "important", "forever", "always", "never",
            "hate", "love", "favorite", "rule", "must");

    private static final List<String> VISION_WORDS = List.of(
            "item", "change", "new", "danger", "threat");

    private static final double EMPHASIS_BOOST = 0.2;
    private static final double NAME_BOOST = 0.15;
    private static final double DIGIT_BOOST = 0.1;
    private static final double QUESTION_BOOST = 0.15;
    private static final double VISION_BOOST = 0.2;

    public double score(String kind, Map<String, ?> payload) {
        return score(EventPayload.of(kind, payload));
    }

    public double score(EventPayload payload) {
        double score = BASE_SCORES.getOrDefault(payload.kind(), DEFAULT_BASE);
        if (payload instanceof EventPayload.Chat chat) {
            score += chatBoost(chat.text());
        } else if (payload instanceof EventPayload.Vision vision) {
            if (containsAny(vision.summary().toLowerCase(Locale.ROOT), VISION_WORDS)) {
                score += VISION_BOOST;
            }
        }
        return Math.min(score, 1.0);
    }

    private double chatBoost(String text) {
        double boost = 0;
        if (containsAny(text.toLowerCase(Locale.ROOT), EMPHATIC_WORDS)) boost += EMPHASIS_BOOST;
        if (hasCapitalizedWord(text)) boost += NAME_BOOST;
        if (text.chars().anyMatch(Character::isDigit)) boost += DIGIT_BOOST;
        if (text.indexOf('?') >= 0) boost += QUESTION_BOOST;
        return boost;
    }

    // substring match: "nevermind" counts as "never"
    private static boolean containsAny(String text, List<String> words) {
        for (var word : words) {
            if (text.contains(word)) return true;
        }
        return false;
    }

    private static boolean hasCapitalizedWord(String text) {
        for (var word : text.trim().split("\\s+")) {
            if (word.length() > 2 && Character.isUpperCase(word.charAt(0))) return true;
        }
        return false;
    }
}
