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

import lamchecker.checker.Certificate;

/**
 * A strategy for re-checking a certificate. Every strategy must reach the same
 * verdict on the same certificate.
 *
 * @author David J. Pearce
 *
 */
public interface Verifier {
	/**
	 * Check that every line of a certificate justifies its entry, that the etom
	 * sorts agree, and that every goal names an entry.
	 *
	 * @param certificate
	 * @return
	 */
	public boolean verify(Certificate certificate);
}
