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
package lamchecker.verify;

import lamchecker.checker.Assertion;
import lamchecker.checker.Certificate;
import lamchecker.checker.CheckerTable;
import lamchecker.checker.Line;
import lamchecker.util.CheckError;

/**
 * Functionality shared by the verification strategies which rebuild a table
 * from a certificate.
 *
 * @author David J. Pearce
 *
 */
public abstract class AbstractVerifier implements Verifier {
	public final static String UNKNOWN_ASSERTION = "line names a missing assertion";

	/**
	 * Apply a single line of a certificate to a table under reconstruction.
	 *
	 * @param table
	 * @param line
	 * @param assertions
	 * @return The position of the entry produced
	 */
	protected static int replay(CheckerTable table, Line line, Assertion[] assertions) {
		if (line.isAssertion()) {
			int i = line.assertion();
			if (i < 0 || i >= assertions.length) {
				throw new CheckError(CheckError.Kind.UNDEFINED_REFERENCE, UNKNOWN_ASSERTION, line);
			}
			Assertion a = assertions[i];
			return table.assertExternal(a.proof(), a.term());
		} else {
			return table.apply(line.step());
		}
	}

	protected static boolean goalsInRange(Certificate certificate) {
		for (int g : certificate.goals()) {
			if (g < 0 || g >= certificate.size()) {
				return false;
			}
		}
		return true;
	}

	protected static void reject(String verifier, int line, String reason) {
		System.err.println(verifier + " rejected line " + line + ": " + reason);
	}
}
