package org.logic.sat;

import org.logic.cnf.Clause;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * PRINCIPIO DI SUSSUNZIONE - Eliminazione di clausole ridondanti
 *
 * Una clausola C1 sussume una clausola C2 se tutti i letterali di C1 compaiono in C2:
 * ogni assegnamento che soddisfa C1 soddisfa anche C2, che può essere eliminata
 * senza alterare l'insieme dei modelli.
 *
 * ESEMPIO:
 * (P) ∧ (¬R ∨ ¬Q) ∧ (P ∨ Q ∨ ¬R) ∧ (A ∨ ¬R ∨ B ∨ ¬Q) ∧ (R ∨ ¬Q)
 * • (P) sussume (P ∨ Q ∨ ¬R)
 * • (¬R ∨ ¬Q) sussume (A ∨ ¬R ∨ B ∨ ¬Q)
 * Risultato: (P) ∧ (¬R ∨ ¬Q) ∧ (R ∨ ¬Q)
 *
 * Il confronto è a coppie; le clausole uguali sopravvivono in una sola copia.
 */
public class SubsumptionPrinciple {

    private static final Logger LOGGER = Logger.getLogger(SubsumptionPrinciple.class.getName());

    private int eliminatedClauses = 0;

    /**
     * Rimuove le clausole sussunte da un'altra clausola della lista.
     *
     * @param clauses clausole da ridurre, non modificate
     * @return clausole superstiti nell'ordine originale
     */
    public List<Clause> applySubsumption(List<Clause> clauses) {
        // Le clausole corte vengono confrontate per prime: sono le candidate a sussumere
        List<Clause> bySize = new ArrayList<>(clauses);
        bySize.sort(Comparator.comparingInt(Clause::size));

        List<Clause> kept = new ArrayList<>();
        for (Clause candidate : bySize) {
            if (kept.stream().noneMatch(smaller -> subsumes(smaller, candidate))) {
                kept.add(candidate);
            }
        }

        List<Clause> result = new ArrayList<>();
        for (Clause clause : clauses) {
            if (kept.remove(clause)) {
                result.add(clause);
            }
        }

        int removed = clauses.size() - result.size();
        eliminatedClauses += removed;
        LOGGER.fine(() -> String.format("Sussunzione: %d clausole, %d eliminate", clauses.size(), removed));
        return result;
    }

    /**
     * Vero se ogni letterale di {@code subsuming} compare in {@code subsumed}.
     */
    public static boolean subsumes(Clause subsuming, Clause subsumed) {
        if (subsuming.size() > subsumed.size()) {
            return false;
        }
        return subsuming.getLiterals().stream().allMatch(subsumed::contains);
    }

    /**
     * @return clausole eliminate da tutte le applicazioni su questa istanza
     */
    public int getEliminatedClausesCount() {
        return eliminatedClauses;
    }
}
