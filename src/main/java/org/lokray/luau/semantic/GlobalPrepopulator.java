package org.lokray.luau.semantic;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstStat;
import org.lokray.luau.ast.AstWalker;
import org.lokray.luau.dfg.DataFlowGraph;
import org.lokray.luau.semantic.symbol.Binding;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.Symbol;
import org.lokray.luau.semantic.type.BlockedType;
import org.lokray.luau.semantic.type.TypeArena;
import org.lokray.luau.semantic.type.TypeId;

import java.util.Optional;

/**
 * Seeds the module's root scope before the main walk. Global functions get a placeholder
 * binding so they can be called before their definition, and every global read whose name is
 * already bound gets its definition mapped to that type.
 */
class GlobalPrepopulator extends AstWalker
{
	private final Scope rootScope;
	private final TypeArena arena;
	private final DataFlowGraph dfg;

	GlobalPrepopulator(Scope rootScope, TypeArena arena, DataFlowGraph dfg)
	{
		this.rootScope = rootScope;
		this.arena = arena;
		this.dfg = dfg;
	}

	@Override
	public Void visitFunction(AstStat.Function stat, Void ctx)
	{
		if (stat.name instanceof AstExpr.Global global)
		{
			TypeId placeholder = arena.addType(new BlockedType());
			rootScope.getBindings().put(Symbol.global(global.name), new Binding(placeholder, global.location));
		}
		return super.visitFunction(stat, ctx);
	}

	@Override
	public Void visitGlobal(AstExpr.Global expr, Void ctx)
	{
		Optional<TypeId> ty = rootScope.lookup(Symbol.global(expr.name));
		ty.ifPresent(typeId -> rootScope.getLvalueTypes().put(dfg.getDef(expr), typeId));
		return null;
	}
}
