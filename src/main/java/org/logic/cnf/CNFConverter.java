package org.logic.cnf;

import org.logic.errors.SatException;
import org.logic.errors.Stage;
import org.logic.expression.FormulaNode;
import org.logic.expression.ParsedExpression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CONVERTITORE CNF - Trasformazione per distribuzione in Forma Normale Congiuntiva
 *
 * Produce una formula equivalente (non solo equisoddisfacibile) sulle stesse
 * variabili della formula sorgente: nessuna variabile ausiliaria viene introdotta.
 *
 * PIPELINE DI CONVERSIONE:
 * 1. Eliminazione di IMPLIES, IFF e XOR in termini di AND, OR, NOT
 * 2. Normalizzazione delle negazioni (leggi di De Morgan, doppia negazione,
 *    costanti invertite) fino ai soli atomi
 * 3. Distribuzione di OR su AND per unione a coppie delle clausole
 * 4. Semplificazione: letterali duplicati collassati, clausole tautologiche
 *    scartate, clausole ripetute rimosse mantenendo l'ordine
 *
 * COSTANTI:
 * • true → nessuna clausola
 * • false → clausola vuota, unica clausola della formula risultante
 *
 * La distribuzione è esponenziale nel caso peggiore (disgiunzioni di congiunzioni);
 * oltre {@code maxClauses} clausole intermedie la conversione si interrompe con
 * una {@link SatException}. Per quelle formule esiste {@link TseitinConverter}.
 */
public class CNFConverter {

    private static final Logger LOGGER = Logger.getLogger(CNFConverter.class.getName());

    public static final int DEFAULT_MAX_CLAUSES = 100_000;

    private final int maxClauses;

    public CNFConverter() {
        this(DEFAULT_MAX_CLAUSES);
    }

    public CNFConverter(int maxClauses) {
        if (maxClauses < 1) {
            throw new IllegalArgumentException("Numero massimo di clausole deve essere positivo: " + maxClauses);
        }
        this.maxClauses = maxClauses;
    }

    //region INTERFACCIA PUBBLICA CONVERSIONE CNF

    /**
     * Converte un'espressione analizzata. Le variabili della formula risultante
     * seguono l'ordine di comparsa nel testo.
     *
     * @throws SatException se la distribuzione supera il limite di clausole
     */
    public CNFFormula convert(ParsedExpression expression) throws SatException {
        Objects.requireNonNull(expression, "Espressione non può essere null");
        return convert(expression.getRoot(), expression.getVariables());
    }

    /**
     * @param root radice dell'AST
     * @param variables ordine di dichiarazione delle variabili
     */
    public CNFFormula convert(FormulaNode root, List<String> variables) throws SatException {
        Objects.requireNonNull(root, "Radice non può essere null");

        FormulaNode basic = eliminateDerivedOperators(root);
        LOGGER.finest(() -> "Operatori derivati eliminati: " + basic);

        FormulaNode normalized = normalizeNegations(basic, false);
        LOGGER.finest(() -> "Negazioni normalizzate: " + normalized);

        List<Set<Literal>> distributed = distributeOrOverAnd(normalized);
        List<Clause> clauses = simplifyStructure(distributed);

        CNFFormula formula = new CNFFormula(clauses, variables);
        LOGGER.fine(() -> String.format("CNF per distribuzione: %d clausole, %d letterali",
                formula.getClauseCount(), formula.getLiteralCount()));
        return formula;
    }

    public int getMaxClauses() {
        return maxClauses;
    }

    //endregion

    //region ELIMINAZIONE OPERATORI DERIVATI

    /**
     * A → B ≡ ¬A ∨ B, A ↔ B ≡ (¬A ∨ B) ∧ (A ∨ ¬B), A ⊕ B ≡ (A ∨ B) ∧ (¬A ∨ ¬B).
     */
    static FormulaNode eliminateDerivedOperators(FormulaNode root) {
        return root.<FormulaNode, RuntimeException>fold((node, a, b) -> switch (node.getType()) {
            case VARIABLE, CONSTANT -> node;
            case NOT -> FormulaNode.not(a);
            case AND, OR -> FormulaNode.binary(node.getType(), a, b);
            case IMPLIES -> FormulaNode.or(FormulaNode.not(a), b);
            case IFF -> FormulaNode.and(
                    FormulaNode.or(FormulaNode.not(a), b),
                    FormulaNode.or(a, FormulaNode.not(b)));
            case XOR -> FormulaNode.and(
                    FormulaNode.or(a, b),
                    FormulaNode.or(FormulaNode.not(a), FormulaNode.not(b)));
        });
    }

    //endregion

    //region NORMALIZZAZIONE NEGAZIONI (LEGGI DE MORGAN)

    /**
     * Forma normale negata di un sottoalbero in entrambe le polarità.
     */
    private record Polarized(FormulaNode positive, FormulaNode negative) {
    }

    /**
     * Spinge le negazioni verso gli atomi. Richiede un albero con soli AND, OR, NOT.
     * Ogni nodo viene normalizzato dal basso in entrambe le polarità, così la
     * negazione di un padre sceglie la forma già pronta del figlio.
     *
     * @param negated true se il sottoalbero è sotto un numero dispari di negazioni
     */
    static FormulaNode normalizeNegations(FormulaNode root, boolean negated) {
        Polarized result = root.<Polarized, RuntimeException>fold((node, left, right) -> switch (node.getType()) {
            case VARIABLE -> new Polarized(node, FormulaNode.not(node));
            case CONSTANT -> new Polarized(node, FormulaNode.constant(!node.getValue()));
            case NOT -> new Polarized(left.negative(), left.positive());
            case AND -> new Polarized(
                    FormulaNode.and(left.positive(), right.positive()),
                    FormulaNode.or(left.negative(), right.negative()));
            case OR -> new Polarized(
                    FormulaNode.or(left.positive(), right.positive()),
                    FormulaNode.and(left.negative(), right.negative()));
            default -> throw new IllegalStateException("Operatore derivato non eliminato: " + node.getType());
        });
        return negated ? result.negative() : result.positive();
    }

    //endregion

    //region DISTRIBUZIONE OR SU AND

    /**
     * Insieme di clausole (come insiemi ordinati di letterali) equivalente al nodo.
     * Lista vuota = vero, lista con un insieme vuoto = falso.
     */
    private List<Set<Literal>> distributeOrOverAnd(FormulaNode root) throws SatException {
        return root.<List<Set<Literal>>, SatException>fold((node, left, right) -> switch (node.getType()) {
            case VARIABLE -> singleton(Literal.positive(node.getName()));
            case NOT -> singleton(Literal.negative(node.getLeft().getName()));
            case CONSTANT -> node.getValue() ? new ArrayList<>() : falseClauses();
            case AND -> {
                left.addAll(right);
                checkClauseLimit(left.size());
                yield left;
            }
            case OR -> applyDistributionTransformation(left, right);
            default -> throw new IllegalStateException("Nodo non normalizzato: " + node.getType());
        });
    }

    /**
     * (c1 ∧ ... ∧ cn) ∨ (d1 ∧ ... ∧ dm) ≡ ∧ (ci ∨ dj). Le clausole tautologiche
     * prodotte dall'unione vengono scartate subito. Le clausole in ingresso
     * appartengono al chiamante e possono essere riusate nel risultato.
     */
    private List<Set<Literal>> applyDistributionTransformation(List<Set<Literal>> left, List<Set<Literal>> right)
            throws SatException {
        checkClauseLimit((long) left.size() * right.size());

        if (right.size() == 1) {
            // Caso delle catene di disgiunzioni: le clausole di sinistra si estendono sul posto
            Set<Literal> rightClause = right.get(0);
            List<Set<Literal>> extended = new ArrayList<>(left.size());
            for (Set<Literal> leftClause : left) {
                if (!complementsAny(leftClause, rightClause)) {
                    leftClause.addAll(rightClause);
                    extended.add(leftClause);
                }
            }
            return extended;
        }

        List<Set<Literal>> product = new ArrayList<>(left.size() * right.size());
        for (Set<Literal> leftClause : left) {
            for (Set<Literal> rightClause : right) {
                if (!complementsAny(leftClause, rightClause)) {
                    Set<Literal> union = new LinkedHashSet<>(leftClause);
                    union.addAll(rightClause);
                    product.add(union);
                }
            }
        }
        return product;
    }

    /**
     * Vero se un letterale di {@code added} è la negazione di un letterale di {@code clause}.
     * Le due clausole sono già prive di coppie complementari al loro interno.
     */
    private static boolean complementsAny(Set<Literal> clause, Set<Literal> added) {
        for (Literal literal : added) {
            if (clause.contains(literal.negate())) {
                return true;
            }
        }
        return false;
    }

    private void checkClauseLimit(long clauseCount) throws SatException {
        if (clauseCount > maxClauses) {
            throw new SatException(Stage.CONVERT, "convertToCnf", String.format(
                    "la distribuzione produce %d clausole, oltre il limite di %d", clauseCount, maxClauses));
        }
    }

    //endregion

    //region SEMPLIFICAZIONE STRUTTURALE

    private static List<Clause> simplifyStructure(List<Set<Literal>> clauseSets) {
        Set<Clause> unique = new LinkedHashSet<>();
        for (Set<Literal> literals : clauseSets) {
            if (literals.isEmpty()) {
                // La clausola vuota assorbe tutte le altre
                return List.of(Clause.of(List.of()));
            }
            if (!containsComplementaryPair(literals)) {
                unique.add(Clause.of(literals));
            }
        }
        return new ArrayList<>(unique);
    }

    private static boolean containsComplementaryPair(Set<Literal> literals) {
        for (Literal literal : literals) {
            if (!literal.negated() && literals.contains(literal.negate())) {
                return true;
            }
        }
        return false;
    }

    private static List<Set<Literal>> singleton(Literal literal) {
        Set<Literal> clause = new LinkedHashSet<>();
        clause.add(literal);
        List<Set<Literal>> clauses = new ArrayList<>();
        clauses.add(clause);
        return clauses;
    }

    private static List<Set<Literal>> falseClauses() {
        List<Set<Literal>> clauses = new ArrayList<>();
        clauses.add(new LinkedHashSet<>());
        return clauses;
    }

    //endregion
}
