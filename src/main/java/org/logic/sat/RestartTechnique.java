package org.logic.sat;

import java.util.logging.Logger;

/**
 * TECNICA DEL RESTART - Ripartenza periodica della ricerca CDCL
 *
 * Ogni {@code conflictThreshold} conflitti la ricerca abbandona tutte le decisioni e
 * riparte dal livello 0. Le clausole apprese e gli assegnamenti del livello 0 restano:
 * la ricerca successiva parte da uno stato più vincolato di quello iniziale, quindi
 * la completezza è preservata.
 *
 * Il solutore chiama {@link #registerConflictAndCheckRestart()} a ogni conflitto
 * e, se la risposta è positiva, esegue il restart e lo notifica con {@link #restartExecuted()}.
 */
public class RestartTechnique {

    private static final Logger LOGGER = Logger.getLogger(RestartTechnique.class.getName());

    public static final int DEFAULT_CONFLICT_THRESHOLD = 5;

    private final int conflictThreshold;

    /** Conflitti dall'ultimo restart. */
    private int currentConflictCount = 0;

    private int totalRestarts = 0;

    public RestartTechnique() {
        this(DEFAULT_CONFLICT_THRESHOLD);
    }

    /**
     * @param conflictThreshold numero di conflitti fra due restart
     * @throws IllegalArgumentException se la soglia è minore di 1
     */
    public RestartTechnique(int conflictThreshold) {
        if (conflictThreshold < 1) {
            throw new IllegalArgumentException("Soglia conflitti deve essere >= 1, ricevuto: " + conflictThreshold);
        }
        this.conflictThreshold = conflictThreshold;
    }

    /**
     * Registra un conflitto.
     *
     * @return true se la soglia è stata raggiunta e la ricerca deve ripartire
     */
    public boolean registerConflictAndCheckRestart() {
        currentConflictCount++;
        LOGGER.finest(() -> "Conflitto registrato: " + currentConflictCount + "/" + conflictThreshold);
        return currentConflictCount >= conflictThreshold;
    }

    /**
     * Azzera il contatore dopo un restart eseguito dal solutore.
     */
    public void restartExecuted() {
        totalRestarts++;
        currentConflictCount = 0;
        LOGGER.fine(() -> "Restart #" + totalRestarts + " eseguito");
    }

    public int getConflictThreshold() {
        return conflictThreshold;
    }

    public int getCurrentConflictCount() {
        return currentConflictCount;
    }

    public int getTotalRestarts() {
        return totalRestarts;
    }

    @Override
    public String toString() {
        return String.format("RestartTechnique[restarts=%d, current=%d/%d]",
                totalRestarts, currentConflictCount, conflictThreshold);
    }
}
