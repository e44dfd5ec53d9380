package org.logic.expression;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.logic.errors.LexException;
import org.logic.errors.ParseException;
import org.logic.expression.grammar.LogicFormulaLexer;
import org.logic.expression.grammar.LogicFormulaParser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Grammatica ANTLR a livelli di precedenza
 *
 * Il testo passa prima dal {@link Lexer}, che rifiuta i token non validi, poi dal parser
 * generato dalla grammatica LogicFormula. L'albero sintattico risultante viene convertito
 * in {@link FormulaNode} da {@link FormulaTreeBuilder}.
 *
 * PRECEDENZA (dal più stretto al più largo):
 * • NOT (prefisso)
 * • AND, NAND
 * • XOR
 * • OR, NOR
 * • IMPLIES
 * • IFF
 *
 * Tutti gli operatori binari sono associativi a sinistra: {@code A -> B -> C}
 * equivale a {@code (A -> B) -> C}. NAND e NOR non hanno un nodo proprio e
 * diventano {@code ¬(a ∧ b)} e {@code ¬(a ∨ b)}.
 *
 * LIMITI:
 * Il parser generato scende di un livello di chiamata per ogni parentesi o negazione
 * annidata. Oltre {@code maxNestingDepth} livelli l'input è rifiutato con una
 * {@link ParseException} prima di avviare il parser. Le catene piatte di operatori
 * binari non hanno limite di lunghezza.
 *
 * Il parser non ha stato tra una chiamata e l'altra ed è utilizzabile da più thread.
 */
public class ExpressionParser {

    private static final Logger LOGGER = Logger.getLogger(ExpressionParser.class.getName());

    public static final int DEFAULT_MAX_NESTING_DEPTH = 1000;

    private final int maxNestingDepth;

    public ExpressionParser() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    public ExpressionParser(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Limite di annidamento deve essere positivo: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Analizza il testo e costruisce l'espressione.
     *
     * @param text formula in notazione infissa
     * @return espressione con AST e variabili libere in ordine di comparsa
     * @throws LexException se il testo contiene caratteri non riconosciuti
     * @throws ParseException se la sequenza di token è malformata, vuota o troppo annidata
     */
    public ParsedExpression parse(String text) throws LexException, ParseException {
        Objects.requireNonNull(text, "Testo della formula non può essere null");

        Lexer lexer = new Lexer(text);
        List<Token> tokens = lexer.tokenize();

        Token first = tokens.get(0);
        if (first.type() == TokenType.END_OF_INPUT) {
            throw new ParseException("parse", "espressione", "input vuoto", first.offset());
        }
        checkNesting(tokens);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer.tokenSource()));
        parser.removeErrorListeners();
        parser.addErrorListener(new SyntaxErrorListener(text.length()));

        FormulaTreeBuilder builder = new FormulaTreeBuilder();
        FormulaNode root;
        try {
            root = builder.visit(parser.formula());
        } catch (ParseCancellationException e) {
            if (e.getCause() instanceof ParseException) {
                throw (ParseException) e.getCause();
            }
            throw e;
        }

        ParsedExpression expression = new ParsedExpression(text, root, builder.getVariables());
        LOGGER.fine(() -> String.format("Formula analizzata: %d token, variabili=%s, altezza=%d",
                tokens.size(), expression.getVariables(), root.getHeight()));
        return expression;
    }

    /**
     * Solo validazione: l'AST viene scartato.
     */
    public void validate(String text) throws LexException, ParseException {
        parse(text);
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    //endregion

    //region CONTROLLO ANNIDAMENTO

    /**
     * Misura la profondità di parentesi e negazioni sulla sequenza di token.
     * Una negazione resta aperta fino alla chiusura del suo operando: un atomo
     * o la parentesi che la segue.
     */
    private void checkNesting(List<Token> tokens) throws ParseException {
        Deque<TokenType> open = new ArrayDeque<>();
        for (Token token : tokens) {
            switch (token.type()) {
                case LEFT_PAREN, NOT -> {
                    open.push(token.type());
                    if (open.size() > maxNestingDepth) {
                        throw new ParseException("parse", "annidamento al massimo " + maxNestingDepth,
                                token.describe(), token.offset());
                    }
                }
                case IDENTIFIER, CONSTANT -> closeNegations(open);
                case RIGHT_PAREN -> {
                    closeNegations(open);
                    if (!open.isEmpty()) {
                        open.pop();
                        closeNegations(open);
                    }
                }
                default -> {
                }
            }
        }
    }

    private static void closeNegations(Deque<TokenType> open) {
        while (!open.isEmpty() && open.peek() == TokenType.NOT) {
            open.pop();
        }
    }

    //endregion

    //region ERRORI SINTATTICI

    /**
     * Converte il primo errore del parser generato in {@link ParseException} e interrompe
     * il parsing: nessun tentativo di recupero.
     */
    private static final class SyntaxErrorListener extends BaseErrorListener {

        private final int sourceLength;

        SyntaxErrorListener(int sourceLength) {
            this.sourceLength = sourceLength;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            org.antlr.v4.runtime.Token token = (org.antlr.v4.runtime.Token) offendingSymbol;
            IntervalSet expectedTokens = e != null ? e.getExpectedTokens() : ((Parser) recognizer).getExpectedTokens();
            boolean endOfInput = token.getType() == org.antlr.v4.runtime.Token.EOF;

            String expected;
            if (expectedTokens.contains(LogicFormulaLexer.IDENTIFIER)) {
                expected = "operando";
            } else if (expectedTokens.contains(LogicFormulaLexer.RPAR)) {
                expected = "')' per chiudere la parentesi";
            } else if (token.getType() == LogicFormulaLexer.RPAR) {
                expected = "fine input (parentesi ')' senza apertura)";
            } else {
                expected = "operatore o fine input";
            }

            String found;
            if (endOfInput) {
                found = TokenType.END_OF_INPUT.getDescription();
            } else if (isOperator(token.getType())) {
                found = "operatore '" + token.getText() + "'";
            } else {
                found = "'" + token.getText() + "'";
            }

            int offset = endOfInput ? sourceLength : token.getStartIndex();
            throw new ParseCancellationException(new ParseException("parse", expected, found, offset));
        }

        private static boolean isOperator(int type) {
            return switch (type) {
                case LogicFormulaLexer.NOT, LogicFormulaLexer.AND, LogicFormulaLexer.NAND, LogicFormulaLexer.OR,
                        LogicFormulaLexer.NOR, LogicFormulaLexer.XOR, LogicFormulaLexer.IMPLIES,
                        LogicFormulaLexer.IFF -> true;
                default -> false;
            };
        }
    }

    //endregion
}
