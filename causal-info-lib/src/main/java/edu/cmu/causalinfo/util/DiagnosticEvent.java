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

import edu.cmu.causalinfo.graph.LaggedNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Something a search wants to tell the caller that is not an error: a node without parents, a source that was not
 * linked to the target, the size of a condition set.
 *
 * @author Joseph Ramsey
 */
public final class DiagnosticEvent {

    public enum Type {
        NO_PARENTS,
        NO_CHILDREN,
        NOT_LINKED,
        SOURCE_DROPPED,
        CONDITIONS_FOUND
    }

    private final Type type;
    private final String message;
    private final List<LaggedNode> nodes;

    public DiagnosticEvent(Type type, String message, LaggedNode... nodes) {
        this.type = type;
        this.message = message;
        this.nodes = Collections.unmodifiableList(Arrays.asList(nodes));
    }

    public Type getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the nodes the event is about, e.g. the source and target of a missing link.
     */
    public List<LaggedNode> getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
