package org.logic.errors;

/**
 * Errore strutturale o di simulazione di un circuito: id duplicato, input mancante,
 * riferimento non risolto, ciclo, uscita sconosciuta.
 */
public class CircuitException extends LogicException {

    private static final long serialVersionUID = 1L;

    private final String nodeId;

    public CircuitException(String operation, String nodeId, String detail) {
        super(Stage.SIMULATE, operation, detail);
        this.nodeId = nodeId;
    }

    /**
     * @return id del nodo coinvolto, null se l'errore non riguarda un nodo preciso
     */
    public String getNodeId() {
        return nodeId;
    }
}
