package org.lokray.luau.semantic;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.luau.dto.ConstraintDTO;
import org.lokray.luau.dto.ErrorDTO;
import org.lokray.luau.dto.GenerationSnapshotDTO;
import org.lokray.luau.dto.ScopeDTO;
import org.lokray.luau.semantic.constraint.Constraint;
import org.lokray.luau.semantic.error.TypeError;
import org.lokray.luau.semantic.module.Module;
import org.lokray.luau.semantic.symbol.Binding;
import org.lokray.luau.semantic.symbol.Scope;
import org.lokray.luau.semantic.symbol.Symbol;
import org.lokray.luau.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Captures what constraint generation produced for one module so it can be written out as JSON.
 */
public class GenerationLogger
{
	private final GenerationSnapshotDTO snapshot = new GenerationSnapshotDTO();

	public void captureGenerationError(TypeError error)
	{
		ErrorDTO dto = new ErrorDTO();
		dto.moduleName = error.getModuleName();
		dto.kind = error.getData().getKind();
		dto.message = error.getData().getMessage();
		dto.location = error.getLocation().toString();
		snapshot.errors.add(dto);
	}

	public void captureGenerationModule(Module module, List<Constraint> constraints)
	{
		snapshot.moduleName = module.getName();
		snapshot.scopes.clear();
		snapshot.constraints.clear();

		Map<Scope, Integer> scopeIndices = new IdentityHashMap<>();
		for (Module.ScopeEntry entry : module.getScopes())
		{
			scopeIndices.put(entry.scope(), scopeIndices.size());
		}

		// --- Scopes ---
		for (Module.ScopeEntry entry : module.getScopes())
		{
			Scope scope = entry.scope();
			ScopeDTO dto = new ScopeDTO();
			dto.index = scopeIndices.get(scope);
			dto.parent = scope.getParent() == null ? null : scopeIndices.get(scope.getParent());
			dto.location = entry.location().toString();
			for (Map.Entry<Symbol, Binding> binding : scope.getBindings().entrySet())
			{
				dto.bindings.put(binding.getKey().getName(), binding.getValue().getTypeId().toString());
			}
			dto.typeAliases.addAll(scope.getPrivateTypeBindings().keySet());
			dto.typeAliases.addAll(scope.getExportedTypeBindings().keySet());
			dto.returnType = scope.getReturnType() == null ? null : scope.getReturnType().toString();
			for (Scope child : scope.getChildren())
			{
				Integer childIndex = scopeIndices.get(child);
				if (childIndex != null)
				{
					dto.children.add(childIndex);
				}
			}
			snapshot.scopes.add(dto);
		}

		// --- Constraints ---
		for (Constraint constraint : constraints)
		{
			ConstraintDTO dto = new ConstraintDTO();
			dto.index = constraint.getIndex();
			dto.kind = constraint.getPayload().getKind();
			dto.location = constraint.getLocation().toString();
			dto.scope = scopeIndices.getOrDefault(constraint.getScope(), -1);
			dto.payload = constraint.getPayload().toString();
			for (Constraint dependency : constraint.getDependencies())
			{
				dto.dependencies.add(dependency.getIndex());
			}
			snapshot.constraints.add(dto);
		}

		Debug.logDebug(module.getName(), "Captured " + snapshot.scopes.size() + " scopes and " + snapshot.constraints.size() + " constraints");
	}

	public GenerationSnapshotDTO getSnapshot()
	{
		return snapshot;
	}

	public String toJson()
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().create();
		return gson.toJson(snapshot);
	}

	/**
	 * Writes the captured snapshot as pretty-printed JSON, replacing any existing file.
	 */
	public void write(Path out) throws IOException
	{
		if (out.getParent() != null)
		{
			Files.createDirectories(out.getParent());
		}
		Files.writeString(out, toJson(), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote constraint generation log to: " + out);
	}
}
