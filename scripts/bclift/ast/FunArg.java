package bclift.ast;

/**
 * A named function type argument.
 */
public record FunArg(String name, Typ type) {
}
