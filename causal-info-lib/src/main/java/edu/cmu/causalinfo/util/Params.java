///////////////////////////////////////////////////////////////////////////////
// For information as to what this class does, see the Javadoc, below.       //
// Copyright (C) 1998, 1999, 2000, 2001, 2002, 2003, 2004, 2005, 2006,       //
// 2007, 2008, 2009, 2010, 2014, 2015 by Peter Spirtes, Richard Scheines, Joseph   //
// Ramsey, and Clark Glymour.                                                //
//                                                                           //
// This program is free software; you can redistribute it and/or modify      //
// it under the terms of the GNU General Public License as published by      //
// the Free Software Foundation; either version 2 of the License, or         //
// (at your option) any later version.                                       //
//                                                                           //
// This program is distributed in the hope that it will be useful,           //
// but WITHOUT ANY WARRANTY; without even the implied warranty of            //
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the             //
// GNU General Public License for more details.                              //
//                                                                           //
// You should have received a copy of the GNU General Public License         //
// along with this program; if not, write to the Free Software               //
// Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA //
///////////////////////////////////////////////////////////////////////////////

package edu.cmu.causalinfo.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Names of the parameters understood by the condition set searches.
 *
 * @author Joseph Ramsey
 */
public final class Params {

    /**
     * Maximum time lag; the graph has taumax + 1 layers.
     */
    public static final String TAUMAX = "taumax";

    /**
     * Approximation level (0, 1 or 2) for the condition set in the non-source variables of bundled components.
     */
    public static final String BUNDLE_LEVEL = "bundleLevel";

    /**
     * Whether condition sets are pruned by weighted transitive reduction unless a call says otherwise.
     */
    public static final String TRANSITIVE = "transitive";

    /**
     * Whether the transitive closure relaxes rows in parallel.
     */
    public static final String PARALLEL_REDUCTION = "parallelReduction";

    public static final String VERBOSE = "verbose";

    private Params() {
    }

    public static List<String> getParameterNames() {
        return Collections.unmodifiableList(Arrays.asList(TAUMAX, BUNDLE_LEVEL, TRANSITIVE, PARALLEL_REDUCTION,
                VERBOSE));
    }
}
