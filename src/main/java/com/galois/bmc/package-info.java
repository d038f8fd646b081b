/**
 * The main package of the bounded model checker, which verifies the
 * assertions of a goto program up to given loop bounds.
 *
 * <p>
 * To check a program, one first builds a
 * {@link com.galois.bmc.cfg.GotoModel} and a
 * {@link com.galois.bmc.BmcOptions} object, and then calls
 * {@link com.galois.bmc.Bmc#run()}.
 */
package com.galois.bmc;
