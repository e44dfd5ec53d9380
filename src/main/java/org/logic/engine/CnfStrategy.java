package org.logic.engine;

/**
 * Strategia di conversione in CNF usata dal sistema SAT.
 */
public enum CnfStrategy {
    /** Distribuzione di OR su AND: formula equivalente, nessuna variabile ausiliaria. */
    DISTRIBUTIVE,
    /** Codifica di Tseitin: dimensione lineare, variabili ausiliarie rimosse dal modello. */
    TSEITIN
}
