package com.dotprint.core.printing;

/**
 * Lexical category of a piece of text with respect to the DOT grammar.
 *
 * @see DotLexicon#classify(String)
 */
public enum TokenClass {
    /** The empty string; must be written as {@code ""} */
    EMPTY,

    /** A reserved word such as {@code graph}; identifier-shaped but must be quoted */
    KEYWORD,

    /** A bare identifier, written without quotes */
    IDENTIFIER,

    /** A numeral, written without quotes */
    NUMBER,

    /** Anything else; must be written as a quoted string */
    OTHER
}
