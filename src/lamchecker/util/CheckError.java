// This file is part of the LamChecker (lamc).
//
// The LamChecker is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The LamChecker is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the LamChecker. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package lamchecker.util;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * This exception is thrown when a term fails to type check, or a checking step
 * cannot be applied to the table it is evaluated against. There is no local
 * recovery from such an error: the offending entry is never appended.
 *
 * @author David J. Pearce
 */
public class CheckError extends RuntimeException {

	/**
	 * Classifies the failures which can arise during checking.
	 */
	public enum Kind {
		/**
		 * A sort or argument mismatch at some node of a term.
		 */
		ILL_TYPED,
		/**
		 * A step names a table position (or atom / etom) which does not exist.
		 */
		UNDEFINED_REFERENCE,
		/**
		 * A step names a table position whose entry has the wrong shape.
		 */
		WRONG_SHAPE,
		/**
		 * A step supplies the wrong number of witnesses or arguments.
		 */
		ARITY_MISMATCH,
		/**
		 * An import-form logical constant reached a place where only resolved
		 * constants are permitted.
		 */
		UNRESOLVED_IMPORT,
		/**
		 * A definition disagrees with an existing binding of the same etom.
		 */
		DUPLICATE_DEFINITION
	}

	private final Kind kind;
	private final String msg;
	private final Object element;
	private final int[] positions;

	/**
	 * Identify a check error arising from a given element.
	 *
	 * @param kind
	 *            The classification of this error.
	 * @param msg
	 *            Message detailing the problem.
	 * @param element
	 *            The offending term, sort, step or entry (may be null).
	 * @param positions
	 *            The table positions involved (if any).
	 */
	public CheckError(Kind kind, String msg, Object element, int... positions) {
		this.kind = kind;
		this.msg = msg;
		this.element = element;
		this.positions = positions;
	}

	@Override
	public String getMessage() {
		if (msg == null) {
			return kind.toString();
		} else if (element == null) {
			return msg;
		} else {
			return msg + ": " + element;
		}
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Error message
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	/**
	 * The term, step or entry responsible for this error.
	 *
	 * @return
	 */
	public Object element() {
		return element;
	}

	/**
	 * The table positions involved in this error.
	 *
	 * @return
	 */
	public int[] positions() {
		return positions;
	}

	/**
	 * Output the error to a given output stream.
	 */
	public void outputError(PrintStream output) {
		output.println(kind.toString().toLowerCase().replace('_', ' ') + ": " + msg);
		if (element != null) {
			output.println("\t" + element);
		}
		if (positions.length > 0) {
			output.println("\tat position(s) " + Arrays.toString(positions));
		}
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof CheckError) {
			CheckError e = (CheckError) o;
			return kind == e.kind && Objects.equals(msg, e.msg) && Arrays.equals(positions, e.positions)
					&& Objects.equals(element, e.element);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return kind.hashCode() ^ Objects.hashCode(msg) ^ Arrays.hashCode(positions);
	}

	public static final long serialVersionUID = 1l;
}
