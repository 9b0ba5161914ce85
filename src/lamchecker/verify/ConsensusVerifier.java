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
 * Accepts a certificate only if every one of a set of strategies accepts it.
 * Disagreement between strategies is a rejection.
 *
 * @author David J. Pearce
 *
 */
public class ConsensusVerifier implements Verifier {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	private final Verifier[] strategies;

	public ConsensusVerifier(Verifier... strategies) {
		if (strategies.length == 0) {
			throw new IllegalArgumentException("at least one strategy required");
		}
		this.strategies = strategies;
	}

	/**
	 * Construct a verifier requiring agreement of the direct, indirect and
	 * compiled strategies.
	 */
	public ConsensusVerifier() {
		this(new DirectVerifier(), new IndirectVerifier(), new CompiledVerifier());
	}

	@Override
	public boolean verify(Certificate certificate) {
		boolean accepted = true;
		for (Verifier v : strategies) {
			boolean r = v.verify(certificate);
			if (DEBUG) {
				System.err.println(v.getClass().getSimpleName() + (r ? " accepted" : " rejected"));
			}
			accepted &= r;
		}
		return accepted;
	}
}
