/**
 * The intermediate representation: immutable modules, declarations,
 * expressions and types, each node carrying a unique identifier.
 */
package exm.quint.ir;
