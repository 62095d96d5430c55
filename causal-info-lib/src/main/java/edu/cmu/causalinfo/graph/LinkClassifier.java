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

package edu.cmu.causalinfo.graph;

import edu.cmu.causalinfo.util.DiagnosticEvent;
import edu.cmu.causalinfo.util.DiagnosticSink;
import org.apache.commons.lang3.Validate;

/**
 * Classifies the link from a source to a target. A direct edge is reported as DIRECTED even though it is also a
 * path of length one.
 *
 * @author Joseph Ramsey
 */
public final class LinkClassifier {
    private final GraphPaths paths;
    private final DiagnosticSink sink;

    public LinkClassifier(GraphPaths paths) {
        this(paths, DiagnosticSink.NONE);
    }

    public LinkClassifier(GraphPaths paths, DiagnosticSink sink) {
        Validate.notNull(paths, "Paths are null.");
        Validate.notNull(sink, "Diagnostic sink is null.");
        this.paths = paths;
        this.sink = sink;
    }

    /**
     * Reports NOT_LINKED when the nodes are not linked.
     */
    public LinkType checkLinks(LaggedNode source, LaggedNode target) {
        return checkLinks(source, target, true);
    }

    /**
     * @param verbose whether a missing link is reported. Searches pass false; for them a missing link is an ordinary
     *                branch.
     */
    public LinkType checkLinks(LaggedNode source, LaggedNode target, boolean verbose) {
        TimeLagGraph graph = paths.getGraph();

        if (!source.equals(target) && graph.isParentOf(source, target)) {
            return LinkType.DIRECTED;
        }

        if (paths.hasCausalPath(source, target)) {
            return LinkType.CAUSAL_PATH;
        }

        if (verbose) {
            sink.report(new DiagnosticEvent(DiagnosticEvent.Type.NOT_LINKED, source + " and " + target
                    + " are not linked by a directed link or a causal path.", source, target));
        }

        return LinkType.NONE;
    }
}
