package org.logic.expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * NODO AST - Albero sintattico immutabile di una formula proposizionale
 *
 * Insieme chiuso di varianti identificate da {@link Type}. Ogni nodo è costruito
 * una sola volta tramite i metodi factory e non viene più modificato: l'albero è
 * aciclico e i figli appartengono esclusivamente al padre.
 *
 * STRUTTURA PER TIPO:
 * • VARIABLE: name valorizzato
 * • CONSTANT: value valorizzato
 * • NOT: solo left (operando)
 * • AND, OR, XOR, IMPLIES, IFF: left e right
 *
 * VISITA:
 * Le formule lette da testo possono essere catene di migliaia di operatori, quindi
 * nessuna visita usa la ricorsione: {@link #fold(Folder)} percorre l'albero in
 * post-ordine con uno stack esplicito, e uguaglianza e rappresentazione testuale
 * fanno lo stesso.
 */
public final class FormulaNode {

    /**
     * Tipi di nodo supportati.
     */
    public enum Type {
        VARIABLE, CONSTANT, NOT, AND, OR, XOR, IMPLIES, IFF;

        public boolean isBinary() {
            return this != VARIABLE && this != CONSTANT && this != NOT;
        }
    }

    /**
     * Combinazione di un nodo con i risultati già calcolati per i suoi figli.
     *
     * @param <R> tipo del risultato
     * @param <X> eccezione controllata che la combinazione può sollevare
     */
    @FunctionalInterface
    public interface Folder<R, X extends Exception> {

        /**
         * @param node nodo corrente
         * @param left risultato dell'operando (NOT) o dell'operando sinistro, null per gli atomi
         * @param right risultato dell'operando destro, null se il nodo non è binario
         */
        R fold(FormulaNode node, R left, R right) throws X;
    }

    /** Elemento dello stack di visita: il nodo e se i suoi figli sono già stati messi in coda. */
    private record Frame(FormulaNode node, boolean expanded) {
    }

    //region ATTRIBUTI

    private final Type type;
    private final String name;
    private final boolean value;
    private final FormulaNode left;
    private final FormulaNode right;
    private final int height;
    private final int hash;

    //endregion

    //region COSTRUZIONE

    private FormulaNode(Type type, String name, boolean value, FormulaNode left, FormulaNode right) {
        this.type = type;
        this.name = name;
        this.value = value;
        this.left = left;
        this.right = right;
        this.height = 1 + Math.max(left != null ? left.height : 0, right != null ? right.height : 0);
        this.hash = Objects.hash(type, name, value, left, right);
    }

    public static FormulaNode variable(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere vuoto");
        }
        return new FormulaNode(Type.VARIABLE, name, false, null, null);
    }

    public static FormulaNode constant(boolean value) {
        return new FormulaNode(Type.CONSTANT, null, value, null, null);
    }

    public static FormulaNode not(FormulaNode operand) {
        return new FormulaNode(Type.NOT, null, false, requireChild(operand), null);
    }

    public static FormulaNode and(FormulaNode left, FormulaNode right) {
        return binary(Type.AND, left, right);
    }

    public static FormulaNode or(FormulaNode left, FormulaNode right) {
        return binary(Type.OR, left, right);
    }

    public static FormulaNode xor(FormulaNode left, FormulaNode right) {
        return binary(Type.XOR, left, right);
    }

    public static FormulaNode implies(FormulaNode left, FormulaNode right) {
        return binary(Type.IMPLIES, left, right);
    }

    public static FormulaNode iff(FormulaNode left, FormulaNode right) {
        return binary(Type.IFF, left, right);
    }

    /**
     * Costruisce un nodo binario del tipo indicato.
     *
     * @throws IllegalArgumentException se il tipo non è binario
     */
    public static FormulaNode binary(Type type, FormulaNode left, FormulaNode right) {
        if (!type.isBinary()) {
            throw new IllegalArgumentException("Tipo non binario: " + type);
        }
        return new FormulaNode(type, null, false, requireChild(left), requireChild(right));
    }

    private static FormulaNode requireChild(FormulaNode child) {
        return Objects.requireNonNull(child, "Operando non può essere null");
    }

    //endregion

    //region ACCESSO

    public Type getType() {
        return type;
    }

    /**
     * @return nome della variabile, null se il nodo non è VARIABLE
     */
    public String getName() {
        return name;
    }

    /**
     * @return valore della costante, significativo solo per CONSTANT
     */
    public boolean getValue() {
        return value;
    }

    /**
     * @return operando di NOT o operando sinistro dei nodi binari
     */
    public FormulaNode getLeft() {
        return left;
    }

    public FormulaNode getRight() {
        return right;
    }

    public int getHeight() {
        return height;
    }

    public boolean isAtom() {
        return type == Type.VARIABLE || type == Type.CONSTANT;
    }

    /**
     * Variabili del sottoalbero in ordine di prima comparsa (visita sinistra-destra).
     */
    public Set<String> collectVariables() {
        Set<String> variables = new LinkedHashSet<>();
        Deque<FormulaNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            FormulaNode node = pending.pop();
            if (node.type == Type.VARIABLE) {
                variables.add(node.name);
            }
            if (node.right != null) {
                pending.push(node.right);
            }
            if (node.left != null) {
                pending.push(node.left);
            }
        }
        return variables;
    }

    //endregion

    //region VISITA

    /**
     * Visita in post-ordine, operando sinistro prima del destro: ogni nodo viene
     * combinato dopo entrambi i figli. Lo stack è esplicito, quindi la profondità
     * dell'albero non è limitata dallo stack delle chiamate.
     *
     * @return risultato calcolato per la radice
     * @throws X la prima eccezione sollevata da {@code folder}
     */
    public <R, X extends Exception> R fold(Folder<R, X> folder) throws X {
        Deque<Frame> pending = new ArrayDeque<>();
        List<R> results = new ArrayList<>();
        pending.push(new Frame(this, false));

        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            FormulaNode node = frame.node();
            if (!frame.expanded() && node.left != null) {
                pending.push(new Frame(node, true));
                if (node.right != null) {
                    pending.push(new Frame(node.right, false));
                }
                pending.push(new Frame(node.left, false));
                continue;
            }
            R rightResult = node.right != null ? results.remove(results.size() - 1) : null;
            R leftResult = node.left != null ? results.remove(results.size() - 1) : null;
            results.add(folder.fold(node, leftResult, rightResult));
        }
        return results.get(0);
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FormulaNode other)) return false;

        Deque<FormulaNode[]> pending = new ArrayDeque<>();
        pending.push(new FormulaNode[]{this, other});
        while (!pending.isEmpty()) {
            FormulaNode[] pair = pending.pop();
            FormulaNode a = pair[0];
            FormulaNode b = pair[1];
            if (a == b) {
                continue;
            }
            if (a.hash != b.hash || a.type != b.type || a.value != b.value || !Objects.equals(a.name, b.name)) {
                return false;
            }
            if (a.left != null) {
                pending.push(new FormulaNode[]{a.left, b.left});
            }
            if (a.right != null) {
                pending.push(new FormulaNode[]{a.right, b.right});
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Rappresentazione con simboli Unicode, completamente parentesizzata
     * per i nodi binari: {@code (A ∧ ¬B)}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        // Nodi ancora da scrivere e frammenti di testo, nell'ordine di uscita
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(this);

        while (!pending.isEmpty()) {
            Object item = pending.pop();
            if (item instanceof String) {
                sb.append((String) item);
                continue;
            }
            FormulaNode node = (FormulaNode) item;
            switch (node.type) {
                case VARIABLE -> sb.append(node.name);
                case CONSTANT -> sb.append(node.value ? "⊤" : "⊥");
                case NOT -> {
                    sb.append('¬');
                    pending.push(node.left);
                }
                default -> {
                    sb.append('(');
                    pending.push(")");
                    pending.push(node.right);
                    pending.push(" " + symbolOf(node.type) + " ");
                    pending.push(node.left);
                }
            }
        }
        return sb.toString();
    }

    private static String symbolOf(Type type) {
        return switch (type) {
            case AND -> "∧";
            case OR -> "∨";
            case XOR -> "⊕";
            case IMPLIES -> "→";
            case IFF -> "↔";
            default -> throw new IllegalArgumentException("Tipo non binario: " + type);
        };
    }

    //endregion
}
