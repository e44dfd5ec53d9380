package org.logic.circuit;

import java.util.List;
import java.util.Objects;

/**
 * Nodo del circuito: identificativo, porta e riferimenti agli ingressi.
 * Ogni riferimento è il nome di un ingresso esterno o l'id di un altro nodo.
 */
public record CircuitNode(String id, GateType gate, List<String> inputs) {

    public CircuitNode {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Id del nodo non può essere vuoto");
        }
        Objects.requireNonNull(gate, "Porta del nodo " + id + " non può essere null");
        inputs = List.copyOf(Objects.requireNonNull(inputs, "Ingressi del nodo " + id + " non possono essere null"));
    }

    @Override
    public String toString() {
        return id + " = " + gate + inputs;
    }
}
