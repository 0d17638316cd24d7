package io.hearthwarrio.pinpoint.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One way of locating an element, with its resilience score.
 */
public final class Candidate {

    /**
     * Highest score first; equal scores keep discovery order (the sort is stable).
     */
    public static final Comparator<Candidate> BY_SCORE_DESCENDING =
            Comparator.comparingInt(Candidate::getScore).reversed();

    private final StrategyKind kind;
    private final String text;
    private final int score;

    public Candidate(StrategyKind kind, String text, int score) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within [0, 100], got " + score);
        }
        this.score = score;
    }

    public StrategyKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getScore() {
        return score;
    }

    /**
     * Returns a new list sorted by score, keeping only the first occurrence of each locator text.
     */
    public static List<Candidate> rank(List<Candidate> candidates) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(BY_SCORE_DESCENDING);

        List<Candidate> out = new ArrayList<>(sorted.size());
        Set<String> seen = new HashSet<>();
        for (Candidate c : sorted) {
            if (seen.add(c.text)) {
                out.add(c);
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Candidate)) {
            return false;
        }
        Candidate other = (Candidate) o;
        return score == other.score && kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, score);
    }

    @Override
    public String toString() {
        return "Candidate{" +
                "kind=" + kind +
                ", score=" + score +
                ", text='" + text + '\'' +
                '}';
    }
}
