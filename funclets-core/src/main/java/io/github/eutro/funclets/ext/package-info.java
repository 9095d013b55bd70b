/**
 * Exts associate arbitrary typed data with IR objects, without changing their classes.
 *
 * <pre>{@code
 * static final Ext<Funclet> ENTRY_OF = Ext.create(Funclet.class, "ENTRY_OF");
 *
 * block.attachExt(ENTRY_OF, funclet);
 * block.getExtOrThrow(ENTRY_OF); // => funclet
 * }</pre>
 * <p>
 * The validator and the SSA engine use them to hang scratch state off basic blocks and variables
 * for the duration of one pass, and to record lasting facts (predecessors, funclet entries, uses)
 * that later consumers of the IR can query.
 * <p>
 * Hot exts may be stored in dedicated fields by specialised {@link io.github.eutro.funclets.ext.ExtContainer}s,
 * see {@link io.github.eutro.funclets.ssa.Var}.
 */
package io.github.eutro.funclets.ext;
