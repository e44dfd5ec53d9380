package org.logic.cnf;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CLAUSOLA - Disgiunzione di letterali
 *
 * I letterali duplicati collassano mantenendo l'ordine di prima comparsa.
 * L'uguaglianza non dipende dall'ordine. La clausola vuota (⊥) compare solo
 * come traduzione della costante falsa e rende la formula insoddisfacibile.
 */
public final class Clause {

    private final List<Literal> literals;
    private final Set<Literal> literalSet;

    private Clause(Collection<Literal> literals) {
        Set<Literal> ordered = new LinkedHashSet<>();
        for (Literal literal : literals) {
            ordered.add(Objects.requireNonNull(literal, "Letterale non può essere null"));
        }
        this.literals = List.copyOf(ordered);
        this.literalSet = Set.copyOf(ordered);
    }

    public static Clause of(Collection<Literal> literals) {
        return new Clause(Objects.requireNonNull(literals, "Letterali non possono essere null"));
    }

    public static Clause of(Literal... literals) {
        return new Clause(List.of(literals));
    }

    public List<Literal> getLiterals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public boolean isUnit() {
        return literals.size() == 1;
    }

    public boolean contains(Literal literal) {
        return literalSet.contains(literal);
    }

    /**
     * Vero se la clausola contiene un letterale e la sua negazione.
     */
    public boolean isTautological() {
        Set<String> positives = new HashSet<>();
        Set<String> negatives = new HashSet<>();
        for (Literal literal : literals) {
            (literal.negated() ? negatives : positives).add(literal.variable());
        }
        positives.retainAll(negatives);
        return !positives.isEmpty();
    }

    public Set<String> getVariables() {
        return literals.stream().map(Literal::variable).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Clause other)) return false;
        return literalSet.equals(other.literalSet);
    }

    @Override
    public int hashCode() {
        return literalSet.hashCode();
    }

    @Override
    public String toString() {
        if (literals.isEmpty()) {
            return "⊥";
        }
        return literals.stream().map(Literal::toString).collect(Collectors.joining(" ∨ ", "(", ")"));
    }
}
