package org.logic.expression;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.TokenSource;
import org.logic.errors.LexException;
import org.logic.expression.grammar.LogicFormulaLexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * LEXER - Scomposizione del testo sorgente in token
 *
 * Adattatore sul lexer ANTLR generato dalla grammatica LogicFormula: legge un token
 * alla volta su richiesta e lo traduce nel {@link Token} del dominio. La sequenza è
 * finita (termina con {@link TokenType#END_OF_INPUT}, restituito anche alle chiamate
 * successive) e riavviabile con {@link #reset()}.
 *
 * FORME RICONOSCIUTE:
 * • Identificatori ASCII: [A-Za-z_][A-Za-z0-9_]*
 * • Costanti (case-insensitive): true, false, t, f, 1, 0
 * • Operatori ASCII: ! & | ^ -> <->
 * • Operatori Unicode: ¬ ∧ ∨ ⊕ → ↔
 * • Parole chiave (case-insensitive): and or not xor nand nor implies iff
 * • Parentesi tonde
 *
 * ERRORI LESSICALI:
 * La grammatica riconosce come token propri le forme non valide, che qui diventano
 * {@link LexException}:
 * • Carattere che non inizia alcun token
 * • Operatore binario raddoppiato (&&, ||, ^^, ∧∧, ∨∨, ⊕⊕): ogni operatore ha una
 *   sola grafia a più caratteri, quindi il doppione non è un secondo operatore
 * • Freccia incompleta ('-', '<' o '<-')
 * • Letterale numerico diverso da 0 e 1
 */
public class Lexer {

    private static final Logger LOGGER = Logger.getLogger(Lexer.class.getName());

    private static final Set<String> TRUE_CONSTANTS = Set.of("true", "t", "1");

    private final String source;
    private final LogicFormulaLexer delegate;

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "Testo sorgente non può essere null");
        this.delegate = new LogicFormulaLexer(CharStreams.fromString(source));
        // Ogni carattere produce un token (UNKNOWN_CHARACTER compreso): il listener di console non serve
        this.delegate.removeErrorListeners();
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Restituisce il prossimo token. Dopo la fine dell'input restituisce sempre
     * un token {@link TokenType#END_OF_INPUT} con offset pari alla lunghezza del sorgente.
     *
     * @return prossimo token
     * @throws LexException se il testo alla posizione corrente non è un token valido
     */
    public Token nextToken() throws LexException {
        Token token = translate(delegate.nextToken());
        LOGGER.finest(() -> "Token letto: " + token);
        return token;
    }

    /**
     * Riporta il lexer all'inizio del sorgente.
     */
    public void reset() {
        delegate.reset();
    }

    /**
     * Legge l'intero sorgente dall'inizio, fine input inclusa.
     *
     * @return lista dei token in ordine, l'ultimo è sempre END_OF_INPUT
     * @throws LexException al primo carattere non riconosciuto
     */
    public List<Token> tokenize() throws LexException {
        reset();
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_INPUT);

        LOGGER.fine(() -> String.format("Tokenizzazione completata: %d token", tokens.size()));
        return tokens;
    }

    public String getSource() {
        return source;
    }

    /**
     * Lexer ANTLR riportato all'inizio, da collegare al parser generato.
     * Va usato dopo {@link #tokenize()}, che ha già escluso i token di errore.
     */
    TokenSource tokenSource() {
        delegate.reset();
        return delegate;
    }

    /**
     * Valore booleano del lessema di una costante già riconosciuta.
     */
    public static boolean constantValue(String lexeme) {
        return TRUE_CONSTANTS.contains(lexeme.toLowerCase(Locale.ROOT));
    }

    //endregion

    //region TRADUZIONE TOKEN ANTLR

    private Token translate(org.antlr.v4.runtime.Token raw) throws LexException {
        int start = raw.getStartIndex();
        return switch (raw.getType()) {
            case org.antlr.v4.runtime.Token.EOF -> new Token(TokenType.END_OF_INPUT, "", source.length());
            case LogicFormulaLexer.NOT -> new Token(TokenType.NOT, raw.getText(), start);
            case LogicFormulaLexer.AND -> new Token(TokenType.AND, raw.getText(), start);
            case LogicFormulaLexer.OR -> new Token(TokenType.OR, raw.getText(), start);
            case LogicFormulaLexer.XOR -> new Token(TokenType.XOR, raw.getText(), start);
            case LogicFormulaLexer.NAND -> new Token(TokenType.NAND, raw.getText(), start);
            case LogicFormulaLexer.NOR -> new Token(TokenType.NOR, raw.getText(), start);
            case LogicFormulaLexer.IMPLIES -> new Token(TokenType.IMPLIES, raw.getText(), start);
            case LogicFormulaLexer.IFF -> new Token(TokenType.IFF, raw.getText(), start);
            case LogicFormulaLexer.LPAR -> new Token(TokenType.LEFT_PAREN, raw.getText(), start);
            case LogicFormulaLexer.RPAR -> new Token(TokenType.RIGHT_PAREN, raw.getText(), start);
            case LogicFormulaLexer.TRUE, LogicFormulaLexer.FALSE -> new Token(TokenType.CONSTANT, raw.getText(), start);
            case LogicFormulaLexer.IDENTIFIER -> new Token(TokenType.IDENTIFIER, raw.getText(), start);
            case LogicFormulaLexer.DOUBLED_OPERATOR ->
                    throw new LexException("nextToken", raw.getText().charAt(1), start + 1, "operatore raddoppiato");
            case LogicFormulaLexer.INCOMPLETE_ARROW -> throw new LexException("nextToken", raw.getText().charAt(0),
                    start, "freccia incompleta, atteso " + (raw.getText().startsWith("<") ? "<->" : "->"));
            case LogicFormulaLexer.INVALID_NUMBER ->
                    throw new LexException("nextToken", raw.getText().charAt(0), start, "letterale numerico non valido");
            default -> throw new LexException("nextToken", raw.getText().charAt(0), start, "carattere non valido");
        };
    }

    //endregion
}
