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

import java.util.Arrays;

import lamchecker.checker.Assertion;
import lamchecker.checker.Certificate;
import lamchecker.checker.CheckerTable;
import lamchecker.checker.Line;
import lamchecker.util.CheckError;

/**
 * Verifies a certificate by running the whole derivation in one go, then
 * performing a single comparison of the resulting entries and etom sorts
 * against those claimed. No line is checked individually.
 *
 * @author David J. Pearce
 *
 */
public class CompiledVerifier extends AbstractVerifier {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	@Override
	public boolean verify(Certificate certificate) {
		CheckerTable table = new CheckerTable(certificate.atomSorts(), certificate.importSorts());
		Assertion[] assertions = certificate.assertions();
		Line[] lines = certificate.lines();
		try {
			for (Line line : lines) {
				replay(table, line, assertions);
			}
		} catch (CheckError e) {
			if (DEBUG) {
				e.outputError(System.err);
			}
			return false;
		}
		return Arrays.equals(table.entries(), certificate.entries())
				&& Arrays.equals(table.etomSorts(), certificate.etomSorts()) && goalsInRange(certificate);
	}
}
