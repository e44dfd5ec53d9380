package org.logic.sat;

import org.logic.errors.SatException;

/**
 * Procedura di decisione per una formula in CNF.
 *
 * Ogni istanza è legata alla formula ricevuta alla costruzione; {@link #solve()}
 * può essere richiamato e riparte da zero.
 */
public interface Solver {

    /**
     * Decide la soddisfacibilità della formula.
     *
     * @return modello SAT o esito UNSAT con statistiche
     * @throws SatException se il budget di decisioni è esaurito o il thread è interrotto
     */
    SolverResult solve() throws SatException;

    /**
     * Nome breve dell'algoritmo, usato nei log e nell'output della CLI.
     */
    String getName();
}
