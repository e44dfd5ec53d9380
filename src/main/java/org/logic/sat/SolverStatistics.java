package org.logic.sat;

/**
 * STATISTICHE DI RISOLUZIONE - Contatori e tempo di una singola ricerca
 *
 * Il timer parte alla costruzione e si ferma con {@link #stopTimer()}.
 * Gli incrementi sono sincronizzati perché le statistiche possono essere lette
 * dal thread che attende il risultato mentre la ricerca è in corso.
 */
public class SolverStatistics {

    //region CONTATORI

    /** Decisioni prese (primo ramo e ramo alternativo). */
    private long decisions = 0;

    /** Letterali forzati dalla propagazione unitaria. */
    private long propagations = 0;

    /** Clausole trovate con tutti i letterali falsi. */
    private long conflicts = 0;

    /** Ritorni a un livello precedente (ramo alternativo o backjump). */
    private long backtracks = 0;

    /** Clausole apprese dai conflitti (solo CDCL). */
    private long learnedClauses = 0;

    /** Ripartenze dal livello 0 (solo CDCL con restart). */
    private long restarts = 0;

    /** Clausole apprese eliminate per sussunzione. */
    private long subsumedClauses = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public SolverStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTO CONTATORI

    public synchronized void incrementDecisions() {
        decisions++;
    }

    public synchronized void incrementPropagations() {
        propagations++;
    }

    public synchronized void incrementConflicts() {
        conflicts++;
    }

    public synchronized void incrementBacktracks() {
        backtracks++;
    }

    public synchronized void incrementLearnedClauses() {
        learnedClauses++;
    }

    public synchronized void incrementRestarts() {
        restarts++;
    }

    public synchronized void addSubsumedClauses(int count) {
        subsumedClauses += count;
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma il timer. Chiamate successive non hanno effetto.
     */
    public synchronized void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale, o tempo parziale se il timer è ancora attivo
     */
    public synchronized long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    public synchronized boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSO

    public synchronized long getDecisions() {
        return decisions;
    }

    public synchronized long getPropagations() {
        return propagations;
    }

    public synchronized long getConflicts() {
        return conflicts;
    }

    public synchronized long getBacktracks() {
        return backtracks;
    }

    public synchronized long getLearnedClauses() {
        return learnedClauses;
    }

    public synchronized long getRestarts() {
        return restarts;
    }

    public synchronized long getSubsumedClauses() {
        return subsumedClauses;
    }

    //endregion

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder(String.format("Decisioni: %d, Propagazioni: %d, Conflitti: %d, Backtrack: %d",
                decisions, propagations, conflicts, backtracks));
        if (learnedClauses > 0) {
            sb.append(", Clausole apprese: ").append(learnedClauses);
        }
        if (restarts > 0) {
            sb.append(", Restart: ").append(restarts);
        }
        if (subsumedClauses > 0) {
            sb.append(", Sussunte: ").append(subsumedClauses);
        }
        return sb.append(", Tempo: ").append(getExecutionTimeMs()).append(" ms").toString();
    }
}
