package org.logic.circuit;

import org.logic.errors.CircuitException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CIRCUITO - Grafo di porte logiche collegate per riferimento
 *
 * STRUTTURA:
 * • Ingressi esterni dichiarati alla costruzione
 * • Tabella dei nodi indirizzata per indice (ordine di inserimento) con mappa id → indice
 * • Uno slot di valore per nodo, vuoto finché il nodo non è valutato nella simulazione corrente
 * • Uscite ordinate
 * • Ordine topologico in cache, invalidato a ogni {@link #addNode}
 *
 * INVARIANTI:
 * • Gli id dei nodi sono unici e diversi dai nomi degli ingressi
 * • Ogni riferimento si risolve in un ingresso o in un nodo (verificato al calcolo
 *   dell'ordine topologico, perché i nodi possono essere aggiunti in qualsiasi ordine)
 * • Il grafo dei collegamenti nodo → nodo è aciclico
 *
 * CONCORRENZA:
 * Nessuna sincronizzazione interna: simulazioni concorrenti sulla stessa istanza
 * si contendono gli slot di valore. Per simulare in parallelo si usa {@link #copy()}.
 */
public class Circuit {

    private static final Logger LOGGER = Logger.getLogger(Circuit.class.getName());

    /**
     * Valore di un nodo nella simulazione corrente.
     */
    private static final class ValueSlot {
        private boolean present;
        private boolean value;

        void clear() {
            present = false;
            value = false;
        }

        void set(boolean newValue) {
            value = newValue;
            present = true;
        }

        Optional<Boolean> get() {
            return present ? Optional.of(value) : Optional.empty();
        }
    }

    //region STATO

    private final Set<String> inputVariables;
    private final List<CircuitNode> nodes = new ArrayList<>();
    private final List<ValueSlot> slots = new ArrayList<>();
    private final Map<String, Integer> indexById = new HashMap<>();
    private final List<String> outputs = new ArrayList<>();

    /** Indici dei nodi in ordine topologico, null se da ricalcolare. */
    private int[] topologicalOrder;

    //endregion

    /**
     * @param inputVariables nomi degli ingressi esterni
     */
    public Circuit(Collection<String> inputVariables) {
        Objects.requireNonNull(inputVariables, "Ingressi non possono essere null");
        Set<String> declared = new LinkedHashSet<>();
        for (String input : inputVariables) {
            if (input == null || input.isEmpty()) {
                throw new IllegalArgumentException("Nome ingresso non può essere vuoto");
            }
            if (!declared.add(input)) {
                throw new IllegalArgumentException("Ingresso duplicato: " + input);
            }
        }
        this.inputVariables = declared;
    }

    //region COSTRUZIONE

    /**
     * Registra un nodo e invalida l'ordine topologico.
     *
     * @throws CircuitException se l'id è vuoto o già usato da un nodo o da un ingresso,
     *                          se manca la porta o se il numero di ingressi non è valido per la porta
     */
    public void addNode(String id, GateType gate, List<String> inputs) throws CircuitException {
        if (id == null || id.isEmpty()) {
            throw new CircuitException("addNode", id, "id del nodo non può essere vuoto");
        }
        if (gate == null) {
            throw new CircuitException("addNode", id, "porta mancante per il nodo " + id);
        }
        if (inputs == null || inputs.contains(null)) {
            throw new CircuitException("addNode", id, "riferimento di ingresso mancante per il nodo " + id);
        }
        CircuitNode node = new CircuitNode(id, gate, inputs);

        if (indexById.containsKey(id)) {
            throw new CircuitException("addNode", id, "nodo già esistente: " + id);
        }
        if (inputVariables.contains(id)) {
            throw new CircuitException("addNode", id, "id coincide con un ingresso esterno: " + id);
        }
        if (!gate.acceptsArity(node.inputs().size())) {
            throw new CircuitException("addNode", id, String.format(
                    "porta %s non accetta %d ingressi", gate, node.inputs().size()));
        }

        indexById.put(id, nodes.size());
        nodes.add(node);
        slots.add(new ValueSlot());
        topologicalOrder = null;

        LOGGER.finest(() -> "Nodo aggiunto: " + node);
    }

    /**
     * Imposta le uscite del circuito, sostituendo le precedenti.
     *
     * @throws CircuitException se un id non è un nodo registrato
     */
    public void setOutputs(List<String> ids) throws CircuitException {
        Objects.requireNonNull(ids, "Uscite non possono essere null");
        for (String id : ids) {
            if (!indexById.containsKey(id)) {
                throw new CircuitException("setOutputs", id, "uscita sconosciuta: " + id);
            }
        }
        outputs.clear();
        outputs.addAll(ids);
    }

    //endregion

    //region ORDINE TOPOLOGICO

    /**
     * @return id dei nodi in ordine topologico (ogni nodo dopo i nodi da cui dipende)
     * @throws CircuitException per riferimenti non risolti o dipendenze circolari
     */
    public List<String> getTopologicalOrder() throws CircuitException {
        List<String> order = new ArrayList<>();
        for (int index : ensureTopology()) {
            order.add(nodes.get(index).id());
        }
        return order;
    }

    private int[] ensureTopology() throws CircuitException {
        if (topologicalOrder == null) {
            topologicalOrder = buildTopology();
            LOGGER.fine(() -> "Ordine topologico calcolato per " + nodes.size() + " nodi");
        }
        return topologicalOrder;
    }

    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    /**
     * Visita in profondità con marcatura a tre colori e pila esplicita.
     * Le radici sono visitate in ordine di inserimento, quindi il risultato è deterministico.
     */
    private int[] buildTopology() throws CircuitException {
        int n = nodes.size();
        byte[] color = new byte[n];
        int[] order = new int[n];
        int orderSize = 0;

        // Ogni frame: {indice nodo, prossimo ingresso da esaminare}
        Deque<int[]> stack = new ArrayDeque<>();

        for (int root = 0; root < n; root++) {
            if (color[root] != UNVISITED) {
                continue;
            }
            color[root] = IN_PROGRESS;
            stack.push(new int[]{root, 0});

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                CircuitNode node = nodes.get(frame[0]);

                if (frame[1] < node.inputs().size()) {
                    String reference = node.inputs().get(frame[1]++);
                    if (inputVariables.contains(reference)) {
                        continue;
                    }
                    Integer dependency = indexById.get(reference);
                    if (dependency == null) {
                        throw new CircuitException("buildTopology", node.id(), String.format(
                                "riferimento non risolto '%s' nel nodo %s", reference, node.id()));
                    }
                    if (color[dependency] == IN_PROGRESS) {
                        throw new CircuitException("buildTopology", node.id(), String.format(
                                "dipendenza circolare rilevata: %s -> %s", node.id(), reference));
                    }
                    if (color[dependency] == UNVISITED) {
                        color[dependency] = IN_PROGRESS;
                        stack.push(new int[]{dependency, 0});
                    }
                } else {
                    color[frame[0]] = DONE;
                    order[orderSize++] = frame[0];
                    stack.pop();
                }
            }
        }
        return order;
    }

    //endregion

    //region SIMULAZIONE

    /**
     * Propaga i valori degli ingressi attraverso il circuito.
     *
     * @param inputs valore di ogni ingresso dichiarato; chiavi aggiuntive sono ignorate
     * @return valore di ogni uscita, nell'ordine delle uscite
     * @throws CircuitException se manca un ingresso, se la topologia non è valida o
     *                          se un'uscita non risulta valutata
     */
    public Map<String, Boolean> simulate(Map<String, Boolean> inputs) throws CircuitException {
        Objects.requireNonNull(inputs, "Valori di ingresso non possono essere null");
        // Una simulazione fallita lascia tutti i nodi non valutati
        slots.forEach(ValueSlot::clear);

        for (String input : inputVariables) {
            if (inputs.get(input) == null) {
                throw new CircuitException("simulate", null, "ingresso mancante: " + input);
            }
        }

        int[] order = ensureTopology();

        try {
            for (int index : order) {
                CircuitNode node = nodes.get(index);
                boolean[] operands = new boolean[node.inputs().size()];
                for (int i = 0; i < operands.length; i++) {
                    operands[i] = resolveReference(node, node.inputs().get(i), inputs);
                }
                slots.get(index).set(node.gate().evaluate(operands));
            }
        } catch (CircuitException e) {
            slots.forEach(ValueSlot::clear);
            throw e;
        }

        Map<String, Boolean> result = new LinkedHashMap<>();
        for (String output : outputs) {
            Optional<Boolean> value = slots.get(indexById.get(output)).get();
            if (value.isEmpty()) {
                throw new CircuitException("simulate", output, "nodo di uscita non valutato: " + output);
            }
            result.put(output, value.get());
        }

        LOGGER.fine(() -> String.format("Simulazione completata: %d nodi, uscite=%s", nodes.size(), result));
        return result;
    }

    private boolean resolveReference(CircuitNode node, String reference, Map<String, Boolean> inputs)
            throws CircuitException {
        if (inputVariables.contains(reference)) {
            return inputs.get(reference);
        }
        Integer dependency = indexById.get(reference);
        Optional<Boolean> value = dependency != null ? slots.get(dependency).get() : Optional.empty();
        if (value.isEmpty()) {
            throw new CircuitException("simulate", node.id(), String.format(
                    "ingresso non risolto '%s' nel nodo %s", reference, node.id()));
        }
        return value.get();
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * Valore del nodo nell'ultima simulazione, vuoto se il nodo non esiste o non è stato valutato.
     */
    public Optional<Boolean> getNodeValue(String id) {
        Integer index = indexById.get(id);
        return index != null ? slots.get(index).get() : Optional.empty();
    }

    public Set<String> getInputVariables() {
        return Set.copyOf(inputVariables);
    }

    public List<String> getOutputs() {
        return List.copyOf(outputs);
    }

    public List<CircuitNode> getNodes() {
        return List.copyOf(nodes);
    }

    public Optional<CircuitNode> getNode(String id) {
        Integer index = indexById.get(id);
        return index != null ? Optional.of(nodes.get(index)) : Optional.empty();
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Copia con la stessa struttura e slot di valore propri.
     */
    public Circuit copy() {
        Circuit copy = new Circuit(inputVariables);
        for (CircuitNode node : nodes) {
            copy.indexById.put(node.id(), copy.nodes.size());
            copy.nodes.add(node);
            copy.slots.add(new ValueSlot());
        }
        copy.outputs.addAll(outputs);
        copy.topologicalOrder = topologicalOrder;
        return copy;
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Circuit{\n");
        sb.append("  ingressi: ").append(inputVariables).append('\n');
        for (int i = 0; i < nodes.size(); i++) {
            sb.append("  ").append(nodes.get(i));
            slots.get(i).get().ifPresent(value -> sb.append(" -> ").append(value));
            sb.append('\n');
        }
        sb.append("  uscite: ").append(outputs).append('\n');
        return sb.append('}').toString();
    }
}
