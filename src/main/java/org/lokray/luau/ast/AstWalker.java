package org.lokray.luau.ast;

import java.util.List;

/**
 * Visits every node below the starting node. Subclasses override the callbacks they care
 * about and call the super implementation to keep descending.
 */
public abstract class AstWalker implements AstStat.Visitor<Void, Void>, AstExpr.Visitor<Void, Void>,
		AstType.Visitor<Void, Void>, AstTypePack.Visitor<Void, Void>
{
	public void walk(AstStat stat)
	{
		if (stat != null)
		{
			stat.accept(this, null);
		}
	}

	public void walk(AstExpr expr)
	{
		if (expr != null)
		{
			expr.accept(this, null);
		}
	}

	public void walk(AstType type)
	{
		if (type != null)
		{
			type.accept(this, null);
		}
	}

	public void walk(AstTypePack pack)
	{
		if (pack != null)
		{
			pack.accept(this, null);
		}
	}

	protected void walkExprs(List<AstExpr> exprs)
	{
		for (AstExpr expr : exprs)
		{
			walk(expr);
		}
	}

	protected void walkTypeList(AstTypeList list)
	{
		if (list == null)
		{
			return;
		}
		for (AstType type : list.types)
		{
			walk(type);
		}
		walk(list.tailType);
	}

	protected void walkLocals(List<AstLocal> locals)
	{
		for (AstLocal local : locals)
		{
			walk(local.annotation);
		}
	}

	// --- Statements ---

	@Override
	public Void visitBlock(AstStat.Block stat, Void ctx)
	{
		for (AstStat child : stat.body)
		{
			walk(child);
		}
		return null;
	}

	@Override
	public Void visitIf(AstStat.If stat, Void ctx)
	{
		walk(stat.condition);
		walk(stat.thenBody);
		walk(stat.elseBody);
		return null;
	}

	@Override
	public Void visitWhile(AstStat.While stat, Void ctx)
	{
		walk(stat.condition);
		walk(stat.body);
		return null;
	}

	@Override
	public Void visitRepeat(AstStat.Repeat stat, Void ctx)
	{
		walk(stat.body);
		walk(stat.condition);
		return null;
	}

	@Override
	public Void visitBreak(AstStat.Break stat, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitContinue(AstStat.Continue stat, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitReturn(AstStat.Return stat, Void ctx)
	{
		walkExprs(stat.list);
		return null;
	}

	@Override
	public Void visitExpr(AstStat.Expr stat, Void ctx)
	{
		walk(stat.expr);
		return null;
	}

	@Override
	public Void visitLocal(AstStat.Local stat, Void ctx)
	{
		walkLocals(stat.vars);
		walkExprs(stat.values);
		return null;
	}

	@Override
	public Void visitFor(AstStat.For stat, Void ctx)
	{
		walk(stat.var.annotation);
		walk(stat.from);
		walk(stat.to);
		walk(stat.step);
		walk(stat.body);
		return null;
	}

	@Override
	public Void visitForIn(AstStat.ForIn stat, Void ctx)
	{
		walkLocals(stat.vars);
		walkExprs(stat.values);
		walk(stat.body);
		return null;
	}

	@Override
	public Void visitAssign(AstStat.Assign stat, Void ctx)
	{
		walkExprs(stat.vars);
		walkExprs(stat.values);
		return null;
	}

	@Override
	public Void visitCompoundAssign(AstStat.CompoundAssign stat, Void ctx)
	{
		walk(stat.var);
		walk(stat.value);
		return null;
	}

	@Override
	public Void visitFunction(AstStat.Function stat, Void ctx)
	{
		walk(stat.name);
		walk(stat.func);
		return null;
	}

	@Override
	public Void visitLocalFunction(AstStat.LocalFunction stat, Void ctx)
	{
		walk(stat.func);
		return null;
	}

	@Override
	public Void visitTypeAlias(AstStat.TypeAlias stat, Void ctx)
	{
		walk(stat.type);
		return null;
	}

	@Override
	public Void visitDeclareGlobal(AstStat.DeclareGlobal stat, Void ctx)
	{
		walk(stat.type);
		return null;
	}

	@Override
	public Void visitDeclareFunction(AstStat.DeclareFunction stat, Void ctx)
	{
		walkTypeList(stat.params);
		walkTypeList(stat.retTypes);
		return null;
	}

	@Override
	public Void visitDeclareClass(AstStat.DeclareClass stat, Void ctx)
	{
		for (AstStat.DeclareClass.Prop prop : stat.props)
		{
			walk(prop.type);
		}
		if (stat.indexer != null)
		{
			walk(stat.indexer.indexType);
			walk(stat.indexer.resultType);
		}
		return null;
	}

	@Override
	public Void visitError(AstStat.Error stat, Void ctx)
	{
		walkExprs(stat.expressions);
		for (AstStat child : stat.statements)
		{
			walk(child);
		}
		return null;
	}

	// --- Expressions ---

	@Override
	public Void visitGroup(AstExpr.Group expr, Void ctx)
	{
		walk(expr.expr);
		return null;
	}

	@Override
	public Void visitConstantNil(AstExpr.ConstantNil expr, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitConstantBool(AstExpr.ConstantBool expr, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitConstantNumber(AstExpr.ConstantNumber expr, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitConstantString(AstExpr.ConstantString expr, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitLocal(AstExpr.Local expr, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitGlobal(AstExpr.Global expr, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitVarargs(AstExpr.Varargs expr, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitCall(AstExpr.Call expr, Void ctx)
	{
		walk(expr.func);
		walkExprs(expr.args);
		return null;
	}

	@Override
	public Void visitIndexName(AstExpr.IndexName expr, Void ctx)
	{
		walk(expr.expr);
		return null;
	}

	@Override
	public Void visitIndexExpr(AstExpr.IndexExpr expr, Void ctx)
	{
		walk(expr.expr);
		walk(expr.index);
		return null;
	}

	@Override
	public Void visitFunction(AstExpr.Function expr, Void ctx)
	{
		if (expr.self != null)
		{
			walk(expr.self.annotation);
		}
		walkLocals(expr.args);
		walk(expr.varargAnnotation);
		walkTypeList(expr.returnAnnotation);
		walk(expr.body);
		return null;
	}

	@Override
	public Void visitTable(AstExpr.Table expr, Void ctx)
	{
		for (AstExpr.Table.Item item : expr.items)
		{
			walk(item.key);
			walk(item.value);
		}
		return null;
	}

	@Override
	public Void visitUnary(AstExpr.Unary expr, Void ctx)
	{
		walk(expr.expr);
		return null;
	}

	@Override
	public Void visitBinary(AstExpr.Binary expr, Void ctx)
	{
		walk(expr.left);
		walk(expr.right);
		return null;
	}

	@Override
	public Void visitIfElse(AstExpr.IfElse expr, Void ctx)
	{
		walk(expr.condition);
		walk(expr.trueExpr);
		walk(expr.falseExpr);
		return null;
	}

	@Override
	public Void visitTypeAssertion(AstExpr.TypeAssertion expr, Void ctx)
	{
		walk(expr.expr);
		walk(expr.annotation);
		return null;
	}

	@Override
	public Void visitInterpString(AstExpr.InterpString expr, Void ctx)
	{
		walkExprs(expr.expressions);
		return null;
	}

	@Override
	public Void visitError(AstExpr.Error expr, Void ctx)
	{
		walkExprs(expr.expressions);
		return null;
	}

	// --- Types ---

	@Override
	public Void visitReference(AstType.Reference type, Void ctx)
	{
		for (AstTypeOrPack param : type.parameters)
		{
			walk(param.type);
			walk(param.typePack);
		}
		return null;
	}

	@Override
	public Void visitTable(AstType.Table type, Void ctx)
	{
		for (AstType.TableProp prop : type.props)
		{
			walk(prop.type);
		}
		if (type.indexer != null)
		{
			walk(type.indexer.indexType);
			walk(type.indexer.resultType);
		}
		return null;
	}

	@Override
	public Void visitFunction(AstType.Function type, Void ctx)
	{
		walkTypeList(type.argTypes);
		walkTypeList(type.returnTypes);
		return null;
	}

	@Override
	public Void visitTypeof(AstType.Typeof type, Void ctx)
	{
		walk(type.expr);
		return null;
	}

	@Override
	public Void visitUnion(AstType.Union type, Void ctx)
	{
		for (AstType part : type.types)
		{
			walk(part);
		}
		return null;
	}

	@Override
	public Void visitIntersection(AstType.Intersection type, Void ctx)
	{
		for (AstType part : type.types)
		{
			walk(part);
		}
		return null;
	}

	@Override
	public Void visitSingletonBool(AstType.SingletonBool type, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitSingletonString(AstType.SingletonString type, Void ctx)
	{
		return null;
	}

	@Override
	public Void visitError(AstType.Error type, Void ctx)
	{
		for (AstType part : type.types)
		{
			walk(part);
		}
		return null;
	}

	// --- Packs ---

	@Override
	public Void visitExplicit(AstTypePack.Explicit pack, Void ctx)
	{
		walkTypeList(pack.typeList);
		return null;
	}

	@Override
	public Void visitVariadic(AstTypePack.Variadic pack, Void ctx)
	{
		walk(pack.variadicType);
		return null;
	}

	@Override
	public Void visitGeneric(AstTypePack.Generic pack, Void ctx)
	{
		return null;
	}
}
