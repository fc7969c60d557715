package org.lokray.luau.dfg;

import org.lokray.luau.ast.AstExpr;
import org.lokray.luau.ast.AstLocal;
import org.lokray.luau.ast.AstStat;
import org.lokray.luau.ast.AstWalker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A small data-flow graph builder for tests. Every write gets a new {@link Def.Cell}, branches
 * of an {@code if} merge into {@link Def.Phi} nodes, and reads of locals, globals and
 * {@code a.b} paths get refinement keys.
 */
public class TestDataFlowGraphBuilder extends AstWalker
{
	private final Map<AstExpr, Def> exprDefs = new IdentityHashMap<>();
	private final Map<AstLocal, Def> localDefs = new IdentityHashMap<>();
	private final Map<AstStat, Def> statDefs = new IdentityHashMap<>();
	private final Map<AstExpr, RefinementKey> keys = new IdentityHashMap<>();
	private final Map<AstExpr, Def> compoundReads = new IdentityHashMap<>();

	// --- Current definitions ---
	private Map<AstLocal, Def> locals = new IdentityHashMap<>();
	private Map<String, Def> globals = new LinkedHashMap<>();
	private final Map<Def, Map<String, Def>> props = new IdentityHashMap<>();

	public static DataFlowGraph build(AstStat.Block block)
	{
		TestDataFlowGraphBuilder builder = new TestDataFlowGraphBuilder();
		builder.walk(block);
		return builder.new Graph();
	}

	private Def cell(String name, boolean subscripted)
	{
		return new Def.Cell(name, subscripted);
	}

	private void recordRead(AstExpr expr, Def def, RefinementKey parent, String propName)
	{
		exprDefs.put(expr, def);
		keys.put(expr, new RefinementKey(parent, def, propName));
	}

	private void write(AstExpr target)
	{
		if (target instanceof AstExpr.Local local)
		{
			Def def = cell(local.local.name, false);
			locals.put(local.local, def);
			recordRead(local, def, null, null);
		}
		else if (target instanceof AstExpr.Global global)
		{
			Def def = cell(global.name, false);
			globals.put(global.name, def);
			recordRead(global, def, null, null);
		}
		else if (target instanceof AstExpr.IndexName indexName)
		{
			walk(indexName.expr);
			Def def = cell(indexName.index, true);
			exprDefs.put(indexName, def);
			RefinementKey parent = keys.get(indexName.expr);
			if (parent != null)
			{
				props.computeIfAbsent(parent.getDef(), d -> new HashMap<>()).put(indexName.index, def);
			}
		}
		else if (target instanceof AstExpr.IndexExpr indexExpr)
		{
			walk(indexExpr.expr);
			walk(indexExpr.index);
			exprDefs.put(indexExpr, cell("[]", true));
		}
		else
		{
			walk(target);
		}
	}

	private Map<AstLocal, Def> snapshotLocals()
	{
		Map<AstLocal, Def> copy = new IdentityHashMap<>();
		copy.putAll(locals);
		return copy;
	}

	private Map<String, Def> snapshotGlobals()
	{
		return new LinkedHashMap<>(globals);
	}

	private void walkLoopBody(AstStat body)
	{
		Map<AstLocal, Def> beforeLocals = snapshotLocals();
		walk(body);
		for (Map.Entry<AstLocal, Def> entry : beforeLocals.entrySet())
		{
			Def after = locals.get(entry.getKey());
			if (after != entry.getValue())
			{
				locals.put(entry.getKey(), new Def.Phi(entry.getKey().name, List.of(entry.getValue(), after)));
			}
		}
	}

	// --- Statements ---

	@Override
	public Void visitLocal(AstStat.Local stat, Void ctx)
	{
		walkLocals(stat.vars);
		walkExprs(stat.values);
		for (AstLocal var : stat.vars)
		{
			Def def = cell(var.name, false);
			localDefs.put(var, def);
			locals.put(var, def);
		}
		return null;
	}

	@Override
	public Void visitAssign(AstStat.Assign stat, Void ctx)
	{
		walkExprs(stat.values);
		for (AstExpr var : stat.vars)
		{
			write(var);
		}
		return null;
	}

	@Override
	public Void visitCompoundAssign(AstStat.CompoundAssign stat, Void ctx)
	{
		walk(stat.value);
		walk(stat.var);
		Def before = exprDefs.get(stat.var);
		if (stat.var instanceof AstExpr.Local || stat.var instanceof AstExpr.Global)
		{
			write(stat.var);
		}
		else
		{
			exprDefs.put(stat.var, cell("compound", true));
		}
		if (before != null)
		{
			compoundReads.put(stat.var, before);
		}
		return null;
	}

	@Override
	public Void visitIf(AstStat.If stat, Void ctx)
	{
		walk(stat.condition);

		Map<AstLocal, Def> beforeLocals = snapshotLocals();
		Map<String, Def> beforeGlobals = snapshotGlobals();

		walk(stat.thenBody);
		Map<AstLocal, Def> thenLocals = locals;
		Map<String, Def> thenGlobals = globals;

		locals = snapshotCopy(beforeLocals);
		globals = new LinkedHashMap<>(beforeGlobals);
		walk(stat.elseBody);

		for (AstLocal local : beforeLocals.keySet())
		{
			Def thenDef = thenLocals.get(local);
			Def elseDef = locals.get(local);
			if (thenDef != elseDef)
			{
				locals.put(local, new Def.Phi(local.name, List.of(thenDef, elseDef)));
			}
		}
		for (Map.Entry<String, Def> entry : thenGlobals.entrySet())
		{
			Def elseDef = globals.get(entry.getKey());
			if (elseDef != null && elseDef != entry.getValue())
			{
				globals.put(entry.getKey(), new Def.Phi(entry.getKey(), List.of(entry.getValue(), elseDef)));
			}
		}
		return null;
	}

	private static Map<AstLocal, Def> snapshotCopy(Map<AstLocal, Def> source)
	{
		Map<AstLocal, Def> copy = new IdentityHashMap<>();
		copy.putAll(source);
		return copy;
	}

	@Override
	public Void visitWhile(AstStat.While stat, Void ctx)
	{
		walk(stat.condition);
		walkLoopBody(stat.body);
		return null;
	}

	@Override
	public Void visitRepeat(AstStat.Repeat stat, Void ctx)
	{
		Map<AstLocal, Def> beforeLocals = snapshotLocals();
		walk(stat.body);
		walk(stat.condition);
		for (Map.Entry<AstLocal, Def> entry : beforeLocals.entrySet())
		{
			Def after = locals.get(entry.getKey());
			if (after != entry.getValue())
			{
				locals.put(entry.getKey(), new Def.Phi(entry.getKey().name, List.of(entry.getValue(), after)));
			}
		}
		return null;
	}

	@Override
	public Void visitFor(AstStat.For stat, Void ctx)
	{
		walk(stat.var.annotation);
		walk(stat.from);
		walk(stat.to);
		walk(stat.step);
		Def def = cell(stat.var.name, false);
		localDefs.put(stat.var, def);
		locals.put(stat.var, def);
		walkLoopBody(stat.body);
		return null;
	}

	@Override
	public Void visitForIn(AstStat.ForIn stat, Void ctx)
	{
		walkLocals(stat.vars);
		walkExprs(stat.values);
		for (AstLocal var : stat.vars)
		{
			Def def = cell(var.name, false);
			localDefs.put(var, def);
			locals.put(var, def);
		}
		walkLoopBody(stat.body);
		return null;
	}

	@Override
	public Void visitFunction(AstStat.Function stat, Void ctx)
	{
		write(stat.name);
		walk(stat.func);
		return null;
	}

	@Override
	public Void visitLocalFunction(AstStat.LocalFunction stat, Void ctx)
	{
		Def def = cell(stat.name.name, false);
		localDefs.put(stat.name, def);
		locals.put(stat.name, def);
		walk(stat.func);
		return null;
	}

	@Override
	public Void visitDeclareGlobal(AstStat.DeclareGlobal stat, Void ctx)
	{
		super.visitDeclareGlobal(stat, ctx);
		Def def = cell(stat.name, false);
		statDefs.put(stat, def);
		globals.put(stat.name, def);
		return null;
	}

	@Override
	public Void visitDeclareFunction(AstStat.DeclareFunction stat, Void ctx)
	{
		super.visitDeclareFunction(stat, ctx);
		Def def = cell(stat.name, false);
		statDefs.put(stat, def);
		globals.put(stat.name, def);
		return null;
	}

	// --- Expressions ---

	@Override
	public Void visitLocal(AstExpr.Local expr, Void ctx)
	{
		Def def = locals.computeIfAbsent(expr.local, l -> cell(l.name, false));
		recordRead(expr, def, null, null);
		return null;
	}

	@Override
	public Void visitGlobal(AstExpr.Global expr, Void ctx)
	{
		Def def = globals.computeIfAbsent(expr.name, n -> cell(n, false));
		recordRead(expr, def, null, null);
		return null;
	}

	@Override
	public Void visitIndexName(AstExpr.IndexName expr, Void ctx)
	{
		walk(expr.expr);
		readProperty(expr, expr.expr, expr.index);
		return null;
	}

	@Override
	public Void visitIndexExpr(AstExpr.IndexExpr expr, Void ctx)
	{
		walk(expr.expr);
		walk(expr.index);
		if (expr.index instanceof AstExpr.ConstantString constant)
		{
			readProperty(expr, expr.expr, constant.value);
		}
		else
		{
			exprDefs.put(expr, cell("[]", false));
		}
		return null;
	}

	private void readProperty(AstExpr expr, AstExpr base, String name)
	{
		RefinementKey parent = keys.get(base);
		if (parent == null)
		{
			exprDefs.put(expr, cell(name, false));
			return;
		}
		Def def = props.computeIfAbsent(parent.getDef(), d -> new HashMap<>()).computeIfAbsent(name, n -> cell(n, false));
		recordRead(expr, def, parent, name);
	}

	@Override
	public Void visitFunction(AstExpr.Function expr, Void ctx)
	{
		Map<AstLocal, Def> outerLocals = snapshotLocals();
		Map<String, Def> outerGlobals = snapshotGlobals();

		List<AstLocal> params = new ArrayList<>();
		if (expr.self != null)
		{
			params.add(expr.self);
		}
		params.addAll(expr.args);
		for (AstLocal param : params)
		{
			Def def = cell(param.name, false);
			localDefs.put(param, def);
			locals.put(param, def);
		}
		super.visitFunction(expr, ctx);

		// Writes inside a body do not flow back into the enclosing code.
		locals = outerLocals;
		globals = outerGlobals;
		return null;
	}

	private class Graph implements DataFlowGraph
	{
		@Override
		public Def getDef(AstExpr expr)
		{
			return require(exprDefs.get(expr), expr);
		}

		@Override
		public Def getDef(AstLocal local)
		{
			return require(localDefs.get(local), local);
		}

		@Override
		public Def getDef(AstStat stat)
		{
			return require(statDefs.get(stat), stat);
		}

		@Override
		public RefinementKey getRefinementKey(AstExpr expr)
		{
			return keys.get(expr);
		}

		@Override
		public Optional<Def> getRValueDefForCompoundAssign(AstExpr expr)
		{
			return Optional.ofNullable(compoundReads.get(expr));
		}

		private Def require(Def def, Object node)
		{
			if (def == null)
			{
				throw new IllegalStateException("No definition for " + node);
			}
			return def;
		}
	}
}
