package org.logic.expression;

import org.antlr.v4.runtime.tree.TerminalNode;
import org.logic.expression.grammar.LogicFormulaBaseVisitor;
import org.logic.expression.grammar.LogicFormulaLexer;
import org.logic.expression.grammar.LogicFormulaParser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Visitor che converte l'albero sintattico ANTLR nell'AST {@link FormulaNode}.
 *
 * Le catene di operatori binari sono alberi sbilanciati a sinistra: la spina sinistra
 * viene percorsa con uno stack esplicito, così una disgiunzione di migliaia di termini
 * non consuma lo stack delle chiamate. Allo stesso modo le sequenze di negazioni e
 * parentesi vengono srotolate in un ciclo.
 *
 * Raccoglie anche le variabili nell'ordine in cui compaiono nel testo.
 * Un'istanza serve per un solo albero.
 */
class FormulaTreeBuilder extends LogicFormulaBaseVisitor<FormulaNode> {

    private final Set<String> variables = new LinkedHashSet<>();

    /**
     * Variabili incontrate durante la visita, in ordine di prima comparsa.
     */
    List<String> getVariables() {
        return List.copyOf(variables);
    }

    //region REGOLE

    @Override
    public FormulaNode visitFormula(LogicFormulaParser.FormulaContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public FormulaNode visitId(LogicFormulaParser.IdContext ctx) {
        String name = ctx.IDENTIFIER().getText();
        variables.add(name);
        return FormulaNode.variable(name);
    }

    @Override
    public FormulaNode visitTrue(LogicFormulaParser.TrueContext ctx) {
        return FormulaNode.constant(true);
    }

    @Override
    public FormulaNode visitFalse(LogicFormulaParser.FalseContext ctx) {
        return FormulaNode.constant(false);
    }

    @Override
    public FormulaNode visitNot(LogicFormulaParser.NotContext ctx) {
        return unwrap(ctx);
    }

    @Override
    public FormulaNode visitPar(LogicFormulaParser.ParContext ctx) {
        return unwrap(ctx);
    }

    @Override
    public FormulaNode visitAnd(LogicFormulaParser.AndContext ctx) {
        return foldLeftSpine(ctx);
    }

    @Override
    public FormulaNode visitXor(LogicFormulaParser.XorContext ctx) {
        return foldLeftSpine(ctx);
    }

    @Override
    public FormulaNode visitOr(LogicFormulaParser.OrContext ctx) {
        return foldLeftSpine(ctx);
    }

    @Override
    public FormulaNode visitImplies(LogicFormulaParser.ImpliesContext ctx) {
        return foldLeftSpine(ctx);
    }

    @Override
    public FormulaNode visitIff(LogicFormulaParser.IffContext ctx) {
        return foldLeftSpine(ctx);
    }

    //endregion

    //region VISITA ITERATIVA

    /**
     * Scende lungo gli operandi sinistri finché trova nodi binari, poi ricompone
     * dal basso applicando ogni operatore al risultato accumulato e al proprio operando destro.
     */
    private FormulaNode foldLeftSpine(LogicFormulaParser.ExpressionContext ctx) {
        Deque<LogicFormulaParser.ExpressionContext> spine = new ArrayDeque<>();
        LogicFormulaParser.ExpressionContext current = ctx;
        while (isBinary(current)) {
            spine.push(current);
            current = current.getRuleContext(LogicFormulaParser.ExpressionContext.class, 0);
        }

        FormulaNode result = visit(current);
        while (!spine.isEmpty()) {
            LogicFormulaParser.ExpressionContext binary = spine.pop();
            FormulaNode right = visit(binary.getRuleContext(LogicFormulaParser.ExpressionContext.class, 1));
            result = combine(operatorOf(binary), result, right);
        }
        return result;
    }

    /**
     * Rimuove negazioni e parentesi consecutive, visita il nucleo e riapplica le negazioni.
     */
    private FormulaNode unwrap(LogicFormulaParser.ExpressionContext ctx) {
        int negations = 0;
        LogicFormulaParser.ExpressionContext current = ctx;
        while (true) {
            if (current instanceof LogicFormulaParser.NotContext) {
                negations++;
                current = ((LogicFormulaParser.NotContext) current).expression();
            } else if (current instanceof LogicFormulaParser.ParContext) {
                current = ((LogicFormulaParser.ParContext) current).expression();
            } else {
                break;
            }
        }

        FormulaNode result = visit(current);
        for (int i = 0; i < negations; i++) {
            result = FormulaNode.not(result);
        }
        return result;
    }

    private static boolean isBinary(LogicFormulaParser.ExpressionContext ctx) {
        return ctx instanceof LogicFormulaParser.AndContext
                || ctx instanceof LogicFormulaParser.XorContext
                || ctx instanceof LogicFormulaParser.OrContext
                || ctx instanceof LogicFormulaParser.ImpliesContext
                || ctx instanceof LogicFormulaParser.IffContext;
    }

    private static int operatorOf(LogicFormulaParser.ExpressionContext binary) {
        return ((TerminalNode) binary.getChild(1)).getSymbol().getType();
    }

    // NAND e NOR non hanno un nodo proprio
    private static FormulaNode combine(int operator, FormulaNode left, FormulaNode right) {
        return switch (operator) {
            case LogicFormulaLexer.AND -> FormulaNode.and(left, right);
            case LogicFormulaLexer.NAND -> FormulaNode.not(FormulaNode.and(left, right));
            case LogicFormulaLexer.XOR -> FormulaNode.xor(left, right);
            case LogicFormulaLexer.OR -> FormulaNode.or(left, right);
            case LogicFormulaLexer.NOR -> FormulaNode.not(FormulaNode.or(left, right));
            case LogicFormulaLexer.IMPLIES -> FormulaNode.implies(left, right);
            case LogicFormulaLexer.IFF -> FormulaNode.iff(left, right);
            default -> throw new IllegalStateException("Operatore binario sconosciuto: " + operator);
        };
    }

    //endregion
}
