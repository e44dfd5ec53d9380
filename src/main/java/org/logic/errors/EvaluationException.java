package org.logic.errors;

/**
 * Valutazione impossibile: variabile assente dall'assegnamento, oppure elenco di
 * variabili non valido per una tavola di verità (duplicati, nomi vuoti, troppe variabili).
 */
public class EvaluationException extends LogicException {

    private static final long serialVersionUID = 1L;

    private final String variable;

    public EvaluationException(String operation, String variable) {
        this(operation, variable, "variabile non definita: " + variable);
    }

    /**
     * @param variable variabile coinvolta, null se l'errore riguarda l'elenco intero
     */
    public EvaluationException(String operation, String variable, String detail) {
        super(Stage.EVALUATE, operation, detail);
        this.variable = variable;
    }

    /**
     * @return variabile coinvolta, null se l'errore riguarda l'elenco intero
     */
    public String getVariable() {
        return variable;
    }
}
