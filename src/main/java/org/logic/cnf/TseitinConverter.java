package org.logic.cnf;

import org.logic.expression.FormulaNode;
import org.logic.expression.ParsedExpression;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * TRASFORMAZIONE DI TSEITIN - CNF equisoddisfacibile di dimensione lineare
 *
 * Ogni sottoformula non atomica riceve una variabile ausiliaria t legata alla
 * sottoformula da clausole di equivalenza t ↔ (a op b); la formula finale è la
 * congiunzione di queste clausole con la clausola unitaria della radice.
 *
 * DIFFERENZE RISPETTO A {@link CNFConverter}:
 * • Dimensione lineare nella dimensione dell'albero
 * • Risultato equisoddisfacibile, non equivalente
 * • Le variabili ausiliarie compaiono in coda all'ordine di dichiarazione; le
 *   variabili sorgente della formula restano quelle del testo, così il modello
 *   può essere ristretto a esse
 *
 * Sottostrutture uguali condividono la stessa variabile ausiliaria. I nomi
 * ausiliari ({@value #AUXILIARY_PREFIX}1, {@value #AUXILIARY_PREFIX}2, ...) non sono
 * identificatori validi per il lexer, quindi non collidono con le variabili utente.
 * Le costanti vengono ripiegate prima della codifica.
 */
public class TseitinConverter {

    private static final Logger LOGGER = Logger.getLogger(TseitinConverter.class.getName());

    public static final String AUXILIARY_PREFIX = "$t";

    //region INTERFACCIA PUBBLICA

    public CNFFormula convert(ParsedExpression expression) {
        Objects.requireNonNull(expression, "Espressione non può essere null");
        return convert(expression.getRoot(), expression.getVariables());
    }

    public CNFFormula convert(FormulaNode root, List<String> variables) {
        Objects.requireNonNull(root, "Radice non può essere null");

        FormulaNode folded = foldConstants(root);
        if (folded.getType() == FormulaNode.Type.CONSTANT) {
            List<Clause> clauses = folded.getValue() ? List.of() : List.of(Clause.of(List.of()));
            return new CNFFormula(clauses, variables);
        }

        EncodingState state = new EncodingState();
        Literal rootLiteral = state.encode(folded);
        state.clauses.add(Clause.of(rootLiteral));

        List<String> declared = new ArrayList<>(variables);
        declared.addAll(state.auxiliaryVariables);
        CNFFormula formula = new CNFFormula(state.clauses, declared, variables);

        LOGGER.fine(() -> String.format("CNF di Tseitin: %d clausole, %d variabili ausiliarie",
                formula.getClauseCount(), state.auxiliaryVariables.size()));
        return formula;
    }

    //endregion

    //region RIPIEGAMENTO COSTANTI

    /**
     * Elimina le costanti: il risultato è una costante oppure un albero senza costanti.
     */
    static FormulaNode foldConstants(FormulaNode root) {
        return root.<FormulaNode, RuntimeException>fold((node, left, right) -> {
            switch (node.getType()) {
                case VARIABLE, CONSTANT -> {
                    return node;
                }
                case NOT -> {
                    return left.getType() == FormulaNode.Type.CONSTANT
                            ? FormulaNode.constant(!left.getValue())
                            : FormulaNode.not(left);
                }
                default -> {
                    boolean leftConstant = left.getType() == FormulaNode.Type.CONSTANT;
                    boolean rightConstant = right.getType() == FormulaNode.Type.CONSTANT;

                    if (leftConstant && rightConstant) {
                        return FormulaNode.constant(applyConstant(node.getType(), left.getValue(), right.getValue()));
                    }
                    if (leftConstant) {
                        return foldWithConstant(node.getType(), left.getValue(), right, true);
                    }
                    if (rightConstant) {
                        return foldWithConstant(node.getType(), right.getValue(), left, false);
                    }
                    return FormulaNode.binary(node.getType(), left, right);
                }
            }
        });
    }

    private static FormulaNode foldWithConstant(FormulaNode.Type type, boolean constant, FormulaNode other,
                                                boolean constantOnLeft) {
        return switch (type) {
            case AND -> constant ? other : FormulaNode.constant(false);
            case OR -> constant ? FormulaNode.constant(true) : other;
            case XOR -> constant ? FormulaNode.not(other) : other;
            case IFF -> constant ? other : FormulaNode.not(other);
            case IMPLIES -> {
                if (constantOnLeft) {
                    yield constant ? other : FormulaNode.constant(true);
                }
                yield constant ? FormulaNode.constant(true) : FormulaNode.not(other);
            }
            default -> throw new IllegalStateException("Tipo non binario: " + type);
        };
    }

    private static boolean applyConstant(FormulaNode.Type type, boolean left, boolean right) {
        return switch (type) {
            case AND -> left && right;
            case OR -> left || right;
            case XOR -> left != right;
            case IMPLIES -> !left || right;
            case IFF -> left == right;
            default -> throw new IllegalStateException("Tipo non binario: " + type);
        };
    }

    //endregion

    //region CODIFICA

    /**
     * Stato di una singola conversione: clausole generate, variabili ausiliarie e
     * mappa sottostruttura → letterale.
     */
    private static final class EncodingState {

        private final List<Clause> clauses = new ArrayList<>();
        private final Set<String> auxiliaryVariables = new LinkedHashSet<>();
        private final Map<FormulaNode, Literal> substructureToLiteral = new HashMap<>();
        private int nextAuxiliaryId = 1;

        /**
         * Letterale che rappresenta la radice, generando le clausole di definizione
         * dal basso: gli operandi ricevono la loro variabile prima del nodo che li usa.
         */
        private Literal encode(FormulaNode root) {
            return root.<Literal, RuntimeException>fold((node, a, b) -> {
                if (node.getType() == FormulaNode.Type.VARIABLE) {
                    return Literal.positive(node.getName());
                }
                if (node.getType() == FormulaNode.Type.NOT && node.getLeft().getType() == FormulaNode.Type.VARIABLE) {
                    return a.negate();
                }
                return substructureToLiteral.computeIfAbsent(node, key -> define(key.getType(), a, b));
            });
        }

        private Literal define(FormulaNode.Type type, Literal a, Literal b) {
            String auxiliary = AUXILIARY_PREFIX + nextAuxiliaryId++;
            auxiliaryVariables.add(auxiliary);
            Literal t = Literal.positive(auxiliary);
            Literal notT = t.negate();

            switch (type) {
                case NOT -> {
                    add(notT, a.negate());
                    add(t, a);
                }
                case AND -> {
                    add(notT, a);
                    add(notT, b);
                    add(t, a.negate(), b.negate());
                }
                case OR -> {
                    add(notT, a, b);
                    add(t, a.negate());
                    add(t, b.negate());
                }
                case XOR -> {
                    add(notT, a, b);
                    add(notT, a.negate(), b.negate());
                    add(t, a.negate(), b);
                    add(t, a, b.negate());
                }
                case IMPLIES -> {
                    add(notT, a.negate(), b);
                    add(t, a);
                    add(t, b.negate());
                }
                case IFF -> {
                    add(notT, a.negate(), b);
                    add(notT, a, b.negate());
                    add(t, a, b);
                    add(t, a.negate(), b.negate());
                }
                default -> throw new IllegalStateException("Nodo non codificabile: " + type);
            }
            return t;
        }

        private void add(Literal... literals) {
            Clause clause = Clause.of(literals);
            // a e b possono coincidere (es. A ∧ A): scarta le clausole tautologiche risultanti
            if (!clause.isTautological()) {
                clauses.add(clause);
            }
        }
    }

    //endregion
}
