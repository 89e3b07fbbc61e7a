/**
 * The frontend package contains the classes that take the constructs
 * completed by the parser and lower them, bottom-up, into the
 * intermediate representation in {@link exm.quint.ir}.
 */
package exm.quint.frontend;
