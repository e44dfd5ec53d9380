package org.logic.circuit;

import org.logic.expression.BooleanOperations;

import java.util.Locale;

/**
 * Porte logiche disponibili nei circuiti. Insieme chiuso: ogni switch sul tipo
 * è esaustivo, quindi una nuova porta obbliga ad aggiornare valutazione e descrizione.
 */
public enum GateType {
    AND, OR, NOT, XOR, XNOR, NAND, NOR;

    /**
     * Applica la porta agli ingressi risolti.
     */
    public boolean evaluate(boolean... inputs) {
        return switch (this) {
            case AND -> BooleanOperations.and(inputs);
            case OR -> BooleanOperations.or(inputs);
            case NOT -> BooleanOperations.not(inputs[0]);
            case XOR -> BooleanOperations.xor(inputs);
            case XNOR -> BooleanOperations.xnor(inputs);
            case NAND -> BooleanOperations.nand(inputs);
            case NOR -> BooleanOperations.nor(inputs);
        };
    }

    public String describe() {
        return switch (this) {
            case AND -> "AND: vero se tutti gli ingressi sono veri";
            case OR -> "OR: vero se almeno un ingresso è vero";
            case NOT -> "NOT: inverte l'unico ingresso";
            case XOR -> "XOR: vero se il numero di ingressi veri è dispari";
            case XNOR -> "XNOR: vero se il numero di ingressi veri è pari";
            case NAND -> "NAND: falso solo se tutti gli ingressi sono veri";
            case NOR -> "NOR: vero solo se tutti gli ingressi sono falsi";
        };
    }

    /**
     * Vero se la porta accetta il numero di ingressi indicato:
     * esattamente uno per NOT, almeno uno per le altre.
     */
    public boolean acceptsArity(int inputCount) {
        return this == NOT ? inputCount == 1 : inputCount >= 1;
    }

    /**
     * Tipo di porta dal nome, senza distinzione tra maiuscole e minuscole.
     *
     * @throws IllegalArgumentException se il nome non corrisponde ad alcuna porta
     */
    public static GateType parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome porta non può essere null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Porta sconosciuta: " + name, e);
        }
    }
}
