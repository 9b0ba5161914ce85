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
package lamchecker.checker;

/**
 * The justification of a single table entry: either the checking step which
 * produced it, or the index of the external assertion it records.
 *
 * @author David J. Pearce
 *
 */
public class Line {
	private final ChkStep step;
	private final int assertion;

	private Line(ChkStep step, int assertion) {
		this.step = step;
		this.assertion = assertion;
	}

	public static Line of(ChkStep step) {
		return new Line(step, -1);
	}

	public static Line asserted(int assertion) {
		return new Line(null, assertion);
	}

	public boolean isAssertion() {
		return step == null;
	}

	/**
	 * The step justifying this line, or <code>null</code> for an assertion.
	 *
	 * @return
	 */
	public ChkStep step() {
		return step;
	}

	/**
	 * The index into the assertion list, or <code>-1</code> for a step.
	 *
	 * @return
	 */
	public int assertion() {
		return assertion;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Line) {
			Line l = (Line) o;
			return assertion == l.assertion && (step == null ? l.step == null : step.equals(l.step));
		}
		return false;
	}

	@Override
	public int hashCode() {
		return step == null ? assertion : step.hashCode();
	}

	@Override
	public String toString() {
		return step == null ? "assertion " + assertion : step.toString();
	}
}
