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
import lamchecker.checker.REntry;
import lamchecker.util.CheckError;

/**
 * Verifies a certificate by replaying every line on a fresh table, comparing
 * the position and entry each line produces against those claimed.
 *
 * @author David J. Pearce
 *
 */
public class DirectVerifier extends AbstractVerifier {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	@Override
	public boolean verify(Certificate certificate) {
		CheckerTable table = new CheckerTable(certificate.atomSorts(), certificate.importSorts());
		Line[] lines = certificate.lines();
		REntry[] entries = certificate.entries();
		Assertion[] assertions = certificate.assertions();
		for (int i = 0; i != lines.length; ++i) {
			int pos;
			try {
				pos = replay(table, lines[i], assertions);
			} catch (CheckError e) {
				if (DEBUG) {
					reject("direct", i, e.getMessage());
				}
				return false;
			}
			if (pos != i || !table.get(i).equals(entries[i])) {
				if (DEBUG) {
					reject("direct", i, "produced " + table.get(pos) + " at " + pos);
				}
				return false;
			}
		}
		return Arrays.equals(table.etomSorts(), certificate.etomSorts()) && goalsInRange(certificate);
	}
}
