package org.logic.errors;

/**
 * Il percorso di risoluzione richiesto non è disponibile: sistema non registrato,
 * conversione CNF oltre i limiti configurati, budget di decisioni esaurito o
 * ricerca interrotta.
 */
public class SatException extends LogicException {

    private static final long serialVersionUID = 1L;

    public SatException(Stage stage, String operation, String detail) {
        super(stage, operation, detail);
    }
}
