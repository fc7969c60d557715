package org.lokray.luau.util;

import org.lokray.luau.semantic.error.TypeError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ErrorHandler
{
	private final List<TypeError> errors = new ArrayList<>();
	private boolean hasErrors = false;

	public void report(TypeError error)
	{
		errors.add(error);
		Debug.logError(error.toString());
		hasErrors = true;
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}

	public List<TypeError> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}
}
