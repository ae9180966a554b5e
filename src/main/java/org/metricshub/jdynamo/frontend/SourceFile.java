package org.metricshub.jdynamo.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jdynamo
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.List;

/**
 * The text of one model together with its name and a table of line starts,
 * used to turn token offsets into {@link Position}s and to render the
 * offending source line under a diagnostic.
 */
public final class SourceFile {

	private final String name;
	private final String content;
	private final List<Integer> lineStarts = new ArrayList<Integer>();

	public SourceFile(String name, String content) {
		this.name = name;
		this.content = content;
		lineStarts.add(0);
		for (int i = 0; i < content.length(); i++) {
			if (content.charAt(i) == '\n') {
				lineStarts.add(i + 1);
			}
		}
	}

	public String getName() {
		return name;
	}

	public String getContent() {
		return content;
	}

	/**
	 * @return number of lines, a trailing newline opening an empty last line
	 */
	public int getLineCount() {
		return lineStarts.size();
	}

	/**
	 * Resolves an offset into a position.
	 *
	 * @param offset zero-based character offset, negative for "no position"
	 * @return the position; unknown (line 0) for a negative offset
	 */
	public Position position(int offset) {
		if (offset < 0) {
			return new Position(name, 0, 0);
		}
		int clamped = Math.min(offset, content.length());
		int line = lineIndex(clamped);
		return new Position(name, line + 1, clamped - lineStarts.get(line) + 1);
	}

	/**
	 * @param line 1-based line number
	 * @return the text of that line, without its newline
	 */
	public String lineText(int line) {
		if (line < 1 || line > lineStarts.size()) {
			throw new IllegalArgumentException("line " + line + " out of range 1.." + lineStarts.size());
		}
		int start = lineStarts.get(line - 1);
		int end = line < lineStarts.size() ? lineStarts.get(line) - 1 : content.length();
		return content.substring(start, end);
	}

	/**
	 * Renders the source line holding the position, with tabs expanded, and a
	 * caret line pointing at the column.
	 *
	 * @param pos a valid position within this file
	 * @param tabWidth columns occupied by a tab
	 * @return two lines, each terminated by a newline
	 */
	public String excerpt(Position pos, int tabWidth) {
		String line = lineText(pos.getLine());
		int before = Math.min(pos.getColumn() - 1, line.length());
		int tabs = 0;
		for (int i = 0; i < before; i++) {
			if (line.charAt(i) == '\t') {
				tabs++;
			}
		}
		int prefixLen = pos.getColumn() - 1 + tabs * (tabWidth - 1);

		StringBuilder out = new StringBuilder();
		out.append(line.replace("\t", " ".repeat(tabWidth))).append('\n');
		out.append(" ".repeat(prefixLen)).append("^\n");
		return out.toString();
	}

	private int lineIndex(int offset) {
		int lo = 0;
		int hi = lineStarts.size() - 1;
		while (lo < hi) {
			int mid = (lo + hi + 1) >>> 1;
			if (lineStarts.get(mid) <= offset) {
				lo = mid;
			} else {
				hi = mid - 1;
			}
		}
		return lo;
	}
}
