package org.logic.errors;

/**
 * Sequenza di token malformata: operando mancante, parentesi non bilanciata,
 * token inatteso o input vuoto.
 */
public class ParseException extends LogicException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;
    private final int offset;

    /**
     * @param operation operazione del parser che ha fallito
     * @param expected costrutto atteso (es. "')'", "operando")
     * @param found lessema trovato al suo posto
     * @param offset posizione del token incriminato nel sorgente
     */
    public ParseException(String operation, String expected, String found, int offset) {
        super(Stage.PARSE, operation,
                String.format("atteso %s ma trovato %s alla posizione %d", expected, found, offset));
        this.expected = expected;
        this.found = found;
        this.offset = offset;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    public int getOffset() {
        return offset;
    }
}
