package org.lokray.luau.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything captured for one module by the generation logger.
 */
public class GenerationSnapshotDTO
{
	public String moduleName;
	public List<ScopeDTO> scopes = new ArrayList<>();
	public List<ConstraintDTO> constraints = new ArrayList<>();
	public List<ErrorDTO> errors = new ArrayList<>();
}
