/**
 * This package contains the instructions of goto programs and the
 * functions and models built from them.
 *
 * <p>
 * Function bodies are most easily written with
 * {@link com.galois.bmc.cfg.GotoProgram}, which resolves labels into jump
 * targets.
 */
package com.galois.bmc.cfg;
