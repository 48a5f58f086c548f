package euclid.util;

import euclid.Unreachable;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * A span of proof source text. Lines and columns are 1-based, offsets are 0-based
 * indices into the source string. The end column and end offset are exclusive.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(-1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startLine < 0;
	}

	public String prettyString() {
		if (isUnknown()) {
			return "at unknown source location";
		}
		return "at line " + startLine + ", column " + startColumn;
	}

	/**
	 * Writes the source line this location starts on, followed by a line of carets
	 * under the located text.
	 */
	public void writeContext(Writer out, CharSequence source) throws IOException {
		if (isUnknown() || startOffset > source.length()) {
			return;
		}
		int lineStart = startOffset;
		while (lineStart > 0 && source.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		int lineEnd = startOffset;
		while (lineEnd < source.length() && source.charAt(lineEnd) != '\n' && source.charAt(lineEnd) != '\r') {
			lineEnd++;
		}
		out.append(source, lineStart, lineEnd);
		out.write(System.lineSeparator());
		for (int pos = lineStart; pos < startOffset; pos++) {
			out.write(source.charAt(pos) == '\t' ? '\t' : ' ');
		}
		int caretEnd = Math.min(Math.max(endOffset, startOffset + 1), Math.max(lineEnd, startOffset + 1));
		for (int pos = startOffset; pos < caretEnd; pos++) {
			out.write('^');
		}
		if (startOffset == source.length()) {
			out.write(" EOF");
		}
	}

	public String contextString(CharSequence source) {
		StringWriter sw = new StringWriter();
		try {
			writeContext(sw, source);
		} catch (IOException e) {
			throw new Unreachable(e); // string ops shouldn't throw IO exceptions
		}
		return sw.toString();
	}

	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		int mStartColumn, mEndColumn;
		if (startLine == other.getStartLine()) {
			mStartColumn = Integer.min(startColumn, other.getStartColumn());
		} else if (startLine < other.getStartLine()) {
			mStartColumn = startColumn;
		} else /* startLine > other.getStartLine() */ {
			mStartColumn = other.getStartColumn();
		}
		if (endLine == other.getEndLine()) {
			mEndColumn = Integer.max(endColumn, other.getEndColumn());
		} else if (endLine > other.getEndLine()) {
			mEndColumn = endColumn;
		} else /* endLine < other.getEndLine() */ {
			mEndColumn = other.getEndColumn();
		}
		return new SourceLocation(
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset),
				Integer.min(startLine, other.getStartLine()),
				Integer.max(endLine, other.getEndLine()),
				mStartColumn,
				mEndColumn);
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + endColumn;
		result = prime * result + endLine;
		result = prime * result + startOffset;
		result = prime * result + endOffset;
		result = prime * result + startColumn;
		result = prime * result + startLine;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine;
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedStartLine = Integer.compare(getStartLine(), o.getStartLine());
		if (comparedStartLine != 0) {
			return comparedStartLine;
		}
		int comparedStartColumn = Integer.compare(getStartColumn(), o.getStartColumn());
		if (comparedStartColumn != 0) {
			return comparedStartColumn;
		}
		return Integer.compare(getEndOffset(), o.getEndOffset());
	}

}
