package org.logic.cnf;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * CONVERTITORE DIMACS - Lettura e scrittura del formato CNF standard
 *
 * FORMATO:
 * • Righe di commento che iniziano con 'c'
 * • Intestazione {@code p cnf <variabili> <clausole>}
 * • Clausole come interi separati da spazi e terminate da 0, anche su più righe
 * • Un eventuale '%' chiude il file (convenzione delle istanze SATLIB)
 *
 * In lettura la variabile k diventa {@code p<k>}; in scrittura la numerazione è
 * quella di {@link CNFFormula#getVariableMapping()} e i nomi originali sono
 * riportati in commento.
 */
public class DimacsConverter {

    private static final Logger LOGGER = Logger.getLogger(DimacsConverter.class.getName());

    //region CONFIGURAZIONE E COSTANTI

    /** Prefisso dei nomi generati per le variabili numeriche. */
    public static final String VARIABLE_PREFIX = "p";

    private static final int CLAUSE_TERMINATOR = 0;
    private static final char COMMENT_CHAR = 'c';
    private static final String PROBLEM_PREFIX = "p cnf";
    private static final String END_MARKER = "%";

    //endregion

    //region LETTURA

    public CNFFormula read(String text) throws IOException {
        return read(new StringReader(Objects.requireNonNull(text, "Testo DIMACS non può essere null")));
    }

    /**
     * Legge una formula DIMACS.
     *
     * @throws IOException in caso di errore di lettura
     * @throws IllegalArgumentException se il contenuto non rispetta il formato
     */
    public CNFFormula read(Reader source) throws IOException {
        Objects.requireNonNull(source, "Sorgente DIMACS non può essere null");

        int declaredVariables = -1;
        int declaredClauses = -1;
        List<Clause> clauses = new ArrayList<>();
        List<Literal> pending = new ArrayList<>();

        BufferedReader reader = new BufferedReader(source);
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.charAt(0) == COMMENT_CHAR) {
                continue;
            }
            if (trimmed.startsWith(END_MARKER)) {
                break;
            }
            if (trimmed.startsWith(PROBLEM_PREFIX)) {
                if (declaredVariables >= 0) {
                    throw new IllegalArgumentException("Intestazione duplicata alla riga " + lineNumber);
                }
                int[] header = parseHeader(trimmed, lineNumber);
                declaredVariables = header[0];
                declaredClauses = header[1];
                continue;
            }
            if (declaredVariables < 0) {
                throw new IllegalArgumentException("Clausola prima dell'intestazione alla riga " + lineNumber);
            }
            parseClauseTokens(trimmed, lineNumber, declaredVariables, pending, clauses);
        }

        if (declaredVariables < 0) {
            throw new IllegalArgumentException("Intestazione 'p cnf' mancante");
        }
        if (!pending.isEmpty()) {
            // Ultima clausola senza terminatore
            clauses.add(Clause.of(pending));
        }
        if (clauses.size() != declaredClauses) {
            LOGGER.warning(String.format("Clausole dichiarate %d, lette %d", declaredClauses, clauses.size()));
        }

        List<String> variables = new ArrayList<>(declaredVariables);
        for (int id = 1; id <= declaredVariables; id++) {
            variables.add(VARIABLE_PREFIX + id);
        }

        LOGGER.fine(String.format("DIMACS letto: %d variabili, %d clausole", declaredVariables, clauses.size()));
        return new CNFFormula(clauses, variables);
    }

    private static int[] parseHeader(String line, int lineNumber) {
        String[] parts = line.split("\\s+");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Intestazione malformata alla riga " + lineNumber + ": " + line);
        }
        try {
            int variables = Integer.parseInt(parts[2]);
            int clauses = Integer.parseInt(parts[3]);
            if (variables < 0 || clauses < 0) {
                throw new IllegalArgumentException("Valori negativi nell'intestazione alla riga " + lineNumber);
            }
            return new int[]{variables, clauses};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Intestazione non numerica alla riga " + lineNumber + ": " + line, e);
        }
    }

    private static void parseClauseTokens(String line, int lineNumber, int declaredVariables,
                                          List<Literal> pending, List<Clause> clauses) {
        for (String token : line.split("\\s+")) {
            int value;
            try {
                value = Integer.parseInt(token);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Letterale non numerico alla riga " + lineNumber + ": " + token, e);
            }
            if (value == CLAUSE_TERMINATOR) {
                clauses.add(Clause.of(pending));
                pending.clear();
                continue;
            }
            int id = Math.abs(value);
            if (id > declaredVariables) {
                throw new IllegalArgumentException(String.format(
                        "Variabile %d fuori intervallo alla riga %d (dichiarate %d)", id, lineNumber, declaredVariables));
            }
            pending.add(new Literal(VARIABLE_PREFIX + id, value < 0));
        }
    }

    //endregion

    //region SCRITTURA

    /**
     * Rappresentazione DIMACS della formula.
     */
    public String write(CNFFormula formula) {
        Objects.requireNonNull(formula, "Formula non può essere null");
        Map<String, Integer> mapping = formula.getVariableMapping();

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> entry : mapping.entrySet()) {
            sb.append(COMMENT_CHAR).append(' ').append(entry.getValue()).append(' ').append(entry.getKey()).append('\n');
        }
        sb.append(PROBLEM_PREFIX).append(' ').append(mapping.size()).append(' ')
                .append(formula.getClauseCount()).append('\n');

        for (Clause clause : formula.getClauses()) {
            for (Literal literal : clause.getLiterals()) {
                int id = mapping.get(literal.variable());
                sb.append(literal.negated() ? -id : id).append(' ');
            }
            sb.append(CLAUSE_TERMINATOR).append('\n');
        }
        return sb.toString();
    }

    //endregion
}
