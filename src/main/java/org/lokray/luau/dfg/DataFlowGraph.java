package org.lokray.luau.dfg;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstLocal;
import org.lokray.luau.ast.AstStat;

import java.util.Optional;

/**
 * Read-only view of the data-flow graph built for one module before constraint generation.
 */
public interface DataFlowGraph
{
	/**
	 * @throws IllegalStateException if the graph assigned no definition to {@code expr}
	 */
	Def getDef(AstExpr expr);

	/**
	 * @throws IllegalStateException if the graph assigned no definition to {@code local}
	 */
	Def getDef(AstLocal local);

	/**
	 * The definition introduced by a declaration statement ({@code declare x: T} or
	 * {@code declare function f()}).
	 *
	 * @throws IllegalStateException if the graph assigned no definition to {@code stat}
	 */
	Def getDef(AstStat stat);

	/**
	 * The refinement key of a read, or null when the read cannot be narrowed.
	 */
	RefinementKey getRefinementKey(AstExpr expr);

	/**
	 * For the target of {@code x op= v}, the definition that is read before the write.
	 */
	Optional<Def> getRValueDefForCompoundAssign(AstExpr expr);
}
