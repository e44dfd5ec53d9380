package org.logic.errors;

import java.util.Objects;

/**
 * ERRORE LOGICO - Radice della gerarchia di errori del motore
 *
 * Tutti i fallimenti "di valore" (input malformato, variabile non definita,
 * circuito incoerente, ricerca SAT non disponibile) sono eccezioni controllate:
 * il chiamante deve gestirle esplicitamente.
 *
 * CONTENUTO:
 * • Fase della pipeline che ha generato l'errore ({@link Stage})
 * • Nome dell'operazione che ha fallito
 * • Messaggio leggibile, senza prefissi
 *
 * Il messaggio completo ha la forma {@code errore logico in <fase>.<operazione>: <dettaglio>}.
 */
public class LogicException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Stage stage;
    private final String operation;
    private final String detail;

    public LogicException(Stage stage, String operation, String detail) {
        this(stage, operation, detail, null);
    }

    public LogicException(Stage stage, String operation, String detail, Throwable cause) {
        super(formatMessage(stage, operation, detail), cause);
        this.stage = Objects.requireNonNull(stage, "Stage non può essere null");
        this.operation = Objects.requireNonNull(operation, "Operazione non può essere null");
        this.detail = Objects.requireNonNull(detail, "Dettaglio non può essere null");
    }

    private static String formatMessage(Stage stage, String operation, String detail) {
        String stageLabel = stage != null ? stage.getLabel() : "?";
        return String.format("errore logico in %s.%s: %s", stageLabel, operation, detail);
    }

    public Stage getStage() {
        return stage;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return messaggio senza il prefisso di fase e operazione
     */
    public String getDetail() {
        return detail;
    }
}
