package org.logic.expression;

/**
 * Tipi di token riconosciuti dal {@link Lexer}.
 * Le forme ASCII, Unicode e a parola chiave dello stesso operatore
 * producono lo stesso tipo.
 */
public enum TokenType {
    IDENTIFIER(Category.IDENTIFIER, "identificatore"),
    CONSTANT(Category.CONSTANT, "costante"),
    NOT(Category.OPERATOR, "'not'"),
    AND(Category.OPERATOR, "'and'"),
    OR(Category.OPERATOR, "'or'"),
    XOR(Category.OPERATOR, "'xor'"),
    NAND(Category.OPERATOR, "'nand'"),
    NOR(Category.OPERATOR, "'nor'"),
    IMPLIES(Category.OPERATOR, "'implies'"),
    IFF(Category.OPERATOR, "'iff'"),
    LEFT_PAREN(Category.PARENTHESIS, "'('"),
    RIGHT_PAREN(Category.PARENTHESIS, "')'"),
    END_OF_INPUT(Category.END, "fine input");

    /** Famiglie di token. */
    public enum Category {
        IDENTIFIER, CONSTANT, OPERATOR, PARENTHESIS, END
    }

    private final Category category;
    private final String description;

    TokenType(Category category, String description) {
        this.category = category;
        this.description = description;
    }

    public Category getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public boolean isOperator() {
        return category == Category.OPERATOR;
    }
}
