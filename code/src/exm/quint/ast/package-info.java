/**
 * Constructs handed over by the parser, one class per grammar production,
 * and the bottom-up walk over a tree of them.
 */
package exm.quint.ast;
