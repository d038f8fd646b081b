/**
 * Symbolic execution of goto programs into an SSA equation.
 */
package com.galois.bmc.symex;
