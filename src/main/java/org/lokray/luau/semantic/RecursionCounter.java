package org.lokray.luau.semantic;

/**
 * Depth counter shared by every recursive entry point of the generator. Each entry is closed
 * when the recursive call returns, usually with try-with-resources.
 */
public class RecursionCounter
{
	private final int limit;
	private int count = 0;

	public RecursionCounter(int limit)
	{
		this.limit = limit;
	}

	public Entry enter()
	{
		count++;
		return new Entry();
	}

	public int getCount()
	{
		return count;
	}

	public int getLimit()
	{
		return limit;
	}

	public final class Entry implements AutoCloseable
	{
		private boolean closed = false;

		private Entry()
		{
		}

		public boolean isExceeded()
		{
			return count > limit;
		}

		@Override
		public void close()
		{
			if (!closed)
			{
				closed = true;
				count--;
			}
		}
	}
}
